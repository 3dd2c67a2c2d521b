package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

/** Per-mount disk usage. */
public class DiskMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("disk_metrics", "disk_metrics")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "host_id", "device_id", "partition", "mount_point", "device_name")
            .decimal("usage_percent")
            .integerRange("total_bytes")
            .integerRange("used_bytes")
            .integerRange("available_bytes")
            .order("timestamp")
            .order("usage_percent")
            .order("used_bytes")
            .order("mount_point")
            .order("device_id")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("mount_point", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "device_id", "device_id",
            "host_id", "host_id",
            "poller_id", "poller_id",
            "agent_id", "agent_id",
            "partition", "partition",
            "mount_point", "mount_point",
            "device_name", "device_name");

    public DiskMetricsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.DISK_METRICS);
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "usage_percent", null, SERIES);
    }
}
