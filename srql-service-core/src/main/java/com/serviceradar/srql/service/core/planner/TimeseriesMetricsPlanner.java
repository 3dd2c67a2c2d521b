package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

/**
 * Generic timeseries, SNMP and rperf metrics. All three share {@code timeseries_metrics}; SNMP and
 * rperf pin {@code metric_type} to their own value whatever filters the query adds.
 */
public class TimeseriesMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("timeseries_metrics", "timeseries_metrics")
            .timeColumn("timestamp")
            .texts("poller_id", "agent_id", "metric_name", "metric_type", "device_id", "target_device_ip", "partition")
            .integer("if_index")
            .decimal("value")
            .order("timestamp")
            .order("metric_name")
            .order("value")
            .order("device_id")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("metric_name", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "metric_name", "metric_name",
            "metric_type", "metric_type",
            "device_id", "device_id",
            "poller_id", "poller_id",
            "agent_id", "agent_id",
            "partition", "partition",
            "target_device_ip", "target_device_ip",
            "if_index", "if_index::text");

    public TimeseriesMetricsPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.TIMESERIES_METRICS, Entity.SNMP_METRICS, Entity.RPERF_METRICS);
    }

    static String forcedMetricType(Entity entity) {
        return switch (entity) {
            case SNMP_METRICS -> "snmp";
            case RPERF_METRICS -> "rperf";
            default -> null;
        };
    }

    @Override
    protected void forcedClauses(QueryPlan plan, SqlClauses where) {
        String metricType = forcedMetricType(plan.entity());
        if (metricType != null) {
            where.add(table.qualified("metric_type") + " = ?", new BindParam.Text(metricType));
        }
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "value", forcedMetricType(entity), SERIES);
    }
}
