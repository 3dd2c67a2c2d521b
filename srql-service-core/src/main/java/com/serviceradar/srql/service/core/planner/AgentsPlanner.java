package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** OCSF agent inventory. Agents keep their own {@code uid}; no device alias rewriting applies. */
public class AgentsPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("agents", "ocsf_agents")
            .timeColumn("last_seen_time")
            .texts("uid", "name", "poller_id", "version", "vendor_name", "ip")
            .integer("type_id")
            .field("capabilities", ValueKind.TEXT_ARRAY_OVERLAP, ColumnHandler.MEMBERSHIP)
            .order("last_seen_time", "last_seen")
            .order("first_seen_time", "first_seen")
            .order("created_time")
            .order("modified_time")
            .order("uid")
            .order("name")
            .order("type_id")
            .order("poller_id")
            .defaultOrder("last_seen_time", OrderDirection.DESC)
            .defaultOrder("uid", OrderDirection.ASC)
            .build();

    public AgentsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.AGENTS);
    }
}
