package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** Gateway (poller) registry. */
public class GatewaysPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("gateways", "pollers")
            .timeColumn("last_seen")
            .text("poller_id", "gateway_id")
            .texts("status", "component_id", "registration_source", "spiffe_identity", "created_by")
            .bool("is_healthy")
            .integerRange("agent_count")
            .integerRange("checker_count")
            .order("last_seen")
            .order("first_seen")
            .order("first_registered")
            .order("poller_id", "gateway_id")
            .order("status")
            .order("agent_count")
            .order("checker_count")
            .order("updated_at")
            .defaultOrder("last_seen", OrderDirection.DESC)
            .defaultOrder("poller_id", OrderDirection.ASC)
            .build();

    public GatewaysPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.GATEWAYS);
    }
}
