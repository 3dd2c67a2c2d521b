package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** Raw discovery sightings, newest first. */
public class DeviceUpdatesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("device_updates", "device_updates")
            .timeColumn("observed_at")
            .texts("device_id", "agent_id", "poller_id", "partition", "discovery_source", "ip", "mac", "hostname")
            .bool("available")
            .order("observed_at", "timestamp")
            .order("device_id")
            .order("ip")
            .order("discovery_source")
            .defaultOrder("observed_at", OrderDirection.DESC)
            .defaultOrder("device_id", OrderDirection.ASC)
            .build();

    public DeviceUpdatesPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.DEVICE_UPDATES);
    }
}
