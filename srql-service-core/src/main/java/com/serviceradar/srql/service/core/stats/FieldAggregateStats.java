package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Flow totals: {@code sum(bytes_total) as bytes by src_endpoint_ip}. Both fields are whitelisted. */
public final class FieldAggregateStats {

    private static final Pattern EXPRESSION =
            Pattern.compile("^(sum|avg|min|max|count)\\( ?(\\*|[a-z_]+) ?\\) as (\\S+)(?: by ([a-z_]+))?$");

    static final Set<String> MEASURES = Set.of("bytes_total", "packets_total", "bytes_in", "bytes_out");
    static final Set<String> GROUP_FIELDS = Set.of(
            "src_endpoint_ip", "src_ip",
            "dst_endpoint_ip", "dst_ip",
            "src_endpoint_port", "src_port",
            "dst_endpoint_port", "dst_port",
            "protocol_name",
            "protocol_num", "proto",
            "sampler_address");

    private FieldAggregateStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where, QueryPlan plan) {
        String normalized = StatsQueries.normalize(expression);
        if (normalized.contains(",")) {
            throw new InvalidRequestException(table.entityLabel() + " stats only support a single expression");
        }
        Matcher m = EXPRESSION.matcher(normalized);
        if (!m.matches()) {
            throw new InvalidRequestException(
                    table.entityLabel() + " stats must look like <agg>(<field>) as <alias> [by <field>]");
        }
        String fn = m.group(1);
        String field = m.group(2);
        String alias = StatsQueries.sanitizeAlias(m.group(3));
        String groupField = m.group(4);

        String aggregate;
        if (field.equals("*")) {
            if (!fn.equals("count")) {
                throw new InvalidRequestException("unsupported " + table.entityLabel() + " stats field '*'");
            }
            aggregate = "COUNT(*)";
        } else {
            if (!MEASURES.contains(field)) {
                throw new InvalidRequestException("unsupported " + table.entityLabel() + " stats field '" + field + "'");
            }
            aggregate = fn.toUpperCase(Locale.ROOT) + "(" + field + ")";
        }

        if (groupField == null) {
            return StatsQueries.single("'" + alias + "', " + aggregate, List.of(), table.table(), where);
        }
        if (!GROUP_FIELDS.contains(groupField)) {
            throw new InvalidRequestException(
                    "unsupported " + table.entityLabel() + " stats group field '" + groupField + "'");
        }
        String column = table.handler(groupField).column();
        String orderBy = StatsQueries.orderBy(
                plan, StatsQueries.sortable(column, column, alias, aggregate), aggregate + " DESC");
        return StatsQueries.grouped(
                "'" + column + "', " + column + ", '" + alias + "', " + aggregate,
                List.of(),
                table.table(),
                where,
                column,
                orderBy,
                plan);
    }
}
