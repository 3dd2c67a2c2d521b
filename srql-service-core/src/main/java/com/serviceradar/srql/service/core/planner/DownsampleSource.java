package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.sql.EntityTable;
import java.util.Map;

/**
 * How a metric entity maps onto the uniform {@code {timestamp, series, value}} downsample shape.
 *
 * @param table filter whitelist and table name
 * @param timestampColumn column fed to {@code time_bucket}
 * @param valueColumn column aggregated into {@code value}
 * @param forcedMetricType required {@code metric_type}, or null
 * @param series series name to SQL expression
 */
public record DownsampleSource(
        EntityTable table,
        String timestampColumn,
        String valueColumn,
        String forcedMetricType,
        Map<String, String> series) {

    public DownsampleSource {
        series = Map.copyOf(series);
    }
}
