package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

/** Per-core CPU samples. */
public class CpuMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("cpu_metrics", "cpu_metrics")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "host_id", "device_id", "partition", "cluster", "label")
            .integer("core_id")
            .decimal("usage_percent")
            .decimal("frequency_hz")
            .order("timestamp")
            .order("usage_percent")
            .order("poller_id")
            .order("device_id")
            .order("host_id")
            .order("partition")
            .order("core_id")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("core_id", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "device_id", "device_id",
            "host_id", "host_id",
            "poller_id", "poller_id",
            "agent_id", "agent_id",
            "core_id", "core_id::text",
            "label", "label",
            "cluster", "cluster",
            "partition", "partition");

    public CpuMetricsPlanner() {
        super(TABLE, StatsGrammar.AVG_BY_DEVICE, Entity.CPU_METRICS);
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "usage_percent", null, SERIES);
    }
}
