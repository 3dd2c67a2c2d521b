package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

public class ProcessMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("process_metrics", "process_metrics")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "host_id", "device_id", "partition", "name", "status", "start_time")
            .integer("pid")
            .decimal("cpu_usage")
            .integerRange("memory_usage")
            .order("timestamp")
            .order("cpu_usage")
            .order("memory_usage")
            .order("pid")
            .order("name")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("pid", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "device_id", "device_id",
            "host_id", "host_id",
            "poller_id", "poller_id",
            "agent_id", "agent_id",
            "partition", "partition",
            "name", "name",
            "pid", "pid::text",
            "status", "status");

    public ProcessMetricsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.PROCESS_METRICS);
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "cpu_usage", null, SERIES);
    }
}
