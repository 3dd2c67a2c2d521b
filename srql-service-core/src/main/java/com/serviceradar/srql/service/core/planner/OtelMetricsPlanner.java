package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.Map;

/** Span-derived RED metrics ({@code otel_metrics}). */
public class OtelMetricsPlanner extends TablePlanner implements DownsampleSourceProvider {

    static final EntityTable TABLE = EntityTable.builder("otel_metrics", "otel_metrics")
            .timeColumn("timestamp")
            .texts("trace_id", "span_id", "span_name", "span_kind", "component", "level", "unit", "metric_name",
                    "http_method", "http_route", "http_status_code", "grpc_service", "grpc_method", "grpc_status_code")
            .text("service_name", "service")
            .text("metric_type", "type")
            .bool("is_slow")
            .decimal("value")
            .decimal("duration_ms")
            .order("timestamp")
            .order("service_name", "service")
            .order("metric_type", "type")
            .order("duration_ms")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("span_id", OrderDirection.ASC)
            .build();

    static final Map<String, String> SERIES = Map.of(
            "metric_name", "metric_name",
            "metric_type", "metric_type",
            "service_name", "service_name",
            "span_name", "span_name",
            "component", "component",
            "level", "level",
            "unit", "unit");

    public OtelMetricsPlanner() {
        super(TABLE, StatsGrammar.COUNT_BY_SERVICE, Entity.OTEL_METRICS);
    }

    @Override
    public DownsampleSource downsampleSource(Entity entity) {
        return new DownsampleSource(TABLE, "timestamp", "value", null, SERIES);
    }
}
