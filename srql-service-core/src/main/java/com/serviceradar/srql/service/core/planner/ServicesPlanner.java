package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** Checker results per service, e.g. {@code in:services available:false stats:"count() as failing"}. */
public class ServicesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("services", "service_status")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "service_name", "service_type", "message", "partition")
            .text("device_id")
            .bool("available")
            .order("timestamp")
            .order("service_name")
            .order("service_type")
            .order("poller_id")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("service_name", OrderDirection.ASC)
            .build();

    public ServicesPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.SERVICES);
    }
}
