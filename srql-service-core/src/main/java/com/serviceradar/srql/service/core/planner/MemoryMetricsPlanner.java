package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

public class MemoryMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("memory_metrics", "memory_metrics")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "host_id", "device_id", "partition")
            .decimal("usage_percent")
            .integerRange("total_bytes")
            .integerRange("used_bytes")
            .integerRange("available_bytes")
            .order("timestamp")
            .order("usage_percent")
            .order("used_bytes")
            .order("device_id")
            .order("host_id")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("device_id", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "device_id", "device_id",
            "host_id", "host_id",
            "poller_id", "poller_id",
            "agent_id", "agent_id",
            "partition", "partition");

    public MemoryMetricsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.MEMORY_METRICS);
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "usage_percent", null, SERIES);
    }
}
