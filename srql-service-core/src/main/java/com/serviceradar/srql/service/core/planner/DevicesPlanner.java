package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/**
 * Device inventory ({@code ocsf_devices}). Devices are keyed by {@code uid}; {@code device_id} is
 * rewritten to it before planning.
 */
public class DevicesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("devices", "ocsf_devices")
            .timeColumn("last_seen_time")
            .text("uid")
            .field("hostname", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("ip", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("mac", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("name", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("vendor_name", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("model", ValueKind.TEXT, ColumnHandler.TEXT_SCALAR)
            .field("poller_id", ValueKind.TEXT, ColumnHandler.EQUALITY)
            .field("agent_id", ValueKind.TEXT, ColumnHandler.EQUALITY)
            .renamed("device_type", "type", ValueKind.TEXT, ColumnHandler.EQUALITY)
            .integer("type_id")
            .bool("is_available")
            .field("discovery_sources", ValueKind.TEXT_ARRAY_CONTAINS, ColumnHandler.MEMBERSHIP)
            .order("uid")
            .order("first_seen_time", "first_seen")
            .order("last_seen_time", "last_seen")
            .order("modified_time", "version_info")
            .order("hostname")
            .order("ip")
            .defaultOrder("last_seen_time", OrderDirection.DESC)
            .defaultOrder("uid", OrderDirection.DESC)
            .build();

    public DevicesPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.DEVICES);
    }
}
