package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** One row per trace with root span details and error counts. */
public class TraceSummariesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("trace_summaries", "otel_trace_summaries")
            .timeColumn("timestamp")
            .selectList("timestamp, trace_id, root_span_id, root_span_name, root_service_name, root_span_kind, "
                    + "start_time_unix_nano, end_time_unix_nano, duration_ms, status_code, status_message, "
                    + "service_set, span_count, error_count")
            .texts("trace_id", "root_span_id", "root_span_name")
            .text("root_service_name", "service_name", "service")
            .field("status_code", ValueKind.INTEGER, ColumnHandler.MEMBERSHIP)
            .field("root_span_kind", ValueKind.INTEGER, ColumnHandler.MEMBERSHIP)
            .integerRange("span_count")
            .integerRange("error_count")
            .decimal("duration_ms")
            .order("timestamp")
            .order("duration_ms")
            .order("span_count")
            .order("error_count")
            .order("root_service_name")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("trace_id", OrderDirection.ASC)
            .build();

    public TraceSummariesPlanner() {
        super(TABLE, StatsGrammar.CONDITIONAL_SUMS, Entity.TRACE_SUMMARIES);
    }
}
