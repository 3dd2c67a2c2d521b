package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import com.serviceradar.srql.service.core.stats.StatsQueries;
import java.util.List;

/**
 * OpenTelemetry log records. Besides rows and multi-aggregate stats, {@code rollup_stats:severity}
 * reads the five-minute severity rollup instead of the raw table.
 */
public class LogsPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("logs", "logs")
            .timeColumn("timestamp")
            .texts("trace_id", "span_id", "service_version", "service_instance", "scope_name", "scope_version", "body")
            .text("service_name", "service")
            .text("severity_text", "severity", "level")
            .integerRange("severity_number")
            .order("timestamp")
            .order("severity_number")
            .order("service_name")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("severity_number", OrderDirection.DESC)
            .build();

    static final EntityTable SEVERITY_ROLLUP = EntityTable.builder("logs", "logs_severity_stats_5m")
            .timeColumn("bucket")
            .field("service_name", ValueKind.TEXT, ColumnHandler.MEMBERSHIP, "service")
            .build();

    private static final String SEVERITY_PAYLOAD = "'total', COALESCE(SUM(total_count), 0), "
            + "'fatal', COALESCE(SUM(fatal_count), 0), "
            + "'error', COALESCE(SUM(error_count), 0), "
            + "'warning', COALESCE(SUM(warning_count), 0), "
            + "'info', COALESCE(SUM(info_count), 0), "
            + "'debug', COALESCE(SUM(debug_count), 0)";

    public LogsPlanner() {
        super(TABLE, StatsGrammar.MULTI_AGGREGATE, Entity.LOGS);
    }

    @Override
    protected CompiledQuery compileRollup(QueryPlan plan) {
        if (!plan.rollupStats().equals("severity")) {
            throw new InvalidRequestException("unsupported rollup_stats type '" + plan.rollupStats() + "'");
        }
        if (plan.timeRange() == null) {
            throw new InvalidRequestException("rollup_stats queries require time:<range>");
        }
        for (Filter filter : plan.filters()) {
            if (!SEVERITY_ROLLUP.filterFields().contains(filter.field())) {
                throw new InvalidRequestException("rollup_stats only supports filtering by service_name");
            }
        }
        SqlClauses where = SEVERITY_ROLLUP.where(plan, false);
        return StatsQueries.single(SEVERITY_PAYLOAD, List.of(), SEVERITY_ROLLUP.table(), where);
    }
}
