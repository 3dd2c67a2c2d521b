package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** CloudEvents-style activity log. */
public class EventsPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("events", "events")
            .timeColumn("event_timestamp")
            .texts("id", "type", "source", "subject", "datacontenttype", "remote_addr", "host",
                    "specversion", "severity", "short_message", "version")
            .integerRange("level")
            .order("event_timestamp", "timestamp")
            .order("severity")
            .order("level")
            .defaultOrder("event_timestamp", OrderDirection.DESC)
            .defaultOrder("id", OrderDirection.DESC)
            .build();

    public EventsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.EVENTS);
    }
}
