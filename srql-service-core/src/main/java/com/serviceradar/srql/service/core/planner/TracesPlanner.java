package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.ValueKind;
import com.serviceradar.srql.service.core.stats.StatsGrammar;

/** Individual spans ({@code otel_traces}). */
public class TracesPlanner extends TablePlanner {

    static final EntityTable TABLE = EntityTable.builder("traces", "otel_traces")
            .timeColumn("timestamp")
            .texts("trace_id", "span_id", "parent_span_id", "service_name", "service_version", "service_instance",
                    "scope_name", "scope_version", "status_message")
            .text("name", "span_name")
            .field("status_code", ValueKind.INTEGER, ColumnHandler.MEMBERSHIP)
            .field("kind", ValueKind.INTEGER, ColumnHandler.MEMBERSHIP, "span_kind")
            .order("timestamp")
            .order("start_time_unix_nano")
            .order("end_time_unix_nano")
            .order("service_name")
            .defaultOrder("timestamp", OrderDirection.DESC)
            .defaultOrder("span_id", OrderDirection.ASC)
            .build();

    public TracesPlanner() {
        super(TABLE, StatsGrammar.COUNT_ONLY, Entity.TRACES);
    }
}
