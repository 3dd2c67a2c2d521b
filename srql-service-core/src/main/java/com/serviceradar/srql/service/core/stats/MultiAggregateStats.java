package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.SrqlTokenizer;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import com.serviceradar.srql.service.core.sql.ValueKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Several aggregates in one payload, e.g.
 * {@code count() as total, group_uniq_array(service_name) as services by severity_text}.
 *
 * Functions: count, sum, avg, min, max and group_uniq_array (distinct values as a JSON array).
 */
public final class MultiAggregateStats {

    private static final Pattern TERM = Pattern.compile("^([a-z_]+)\\( ?([a-z_*]*) ?\\)(?: as (\\S+))?$");
    private static final Pattern GROUPED = Pattern.compile("^(.*) by ([a-z_]+)$");

    private MultiAggregateStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where, QueryPlan plan) {
        List<String> terms = new ArrayList<>();
        for (String term : SrqlTokenizer.splitTopLevel(expression, ',')) {
            terms.add(StatsQueries.normalize(term));
        }
        if (terms.isEmpty()) {
            throw new InvalidRequestException("stats expression cannot be empty");
        }
        if (terms.size() > StatsQueries.MAX_EXPRESSIONS) {
            throw new InvalidRequestException("stats supports at most " + StatsQueries.MAX_EXPRESSIONS + " expressions");
        }

        String groupColumn = null;
        Matcher grouped = GROUPED.matcher(terms.get(terms.size() - 1));
        if (grouped.matches()) {
            terms.set(terms.size() - 1, grouped.group(1).trim());
            ColumnHandler handler = column(table, grouped.group(2));
            if (handler.kind() != ValueKind.TEXT && handler.kind() != ValueKind.INTEGER) {
                throw new InvalidRequestException("cannot group " + table.entityLabel() + " stats by '" + grouped.group(2) + "'");
            }
            groupColumn = handler.column();
        }

        Map<String, String> aggregates = new LinkedHashMap<>();
        for (String term : terms) {
            Matcher m = TERM.matcher(term);
            if (!m.matches()) {
                throw new InvalidRequestException("unsupported stats expression '" + term + "'");
            }
            String fn = m.group(1);
            String arg = m.group(2);
            String expr = aggregate(table, fn, arg);
            String defaultAlias = arg.isEmpty() || arg.equals("*") ? fn : fn + "_" + arg;
            String alias = StatsQueries.sanitizeAlias(m.group(3) == null ? defaultAlias : m.group(3));
            if (aggregates.putIfAbsent(alias, expr) != null) {
                throw new InvalidRequestException("duplicate stats alias '" + alias + "'");
            }
        }

        List<String> args = new ArrayList<>();
        if (groupColumn != null) {
            args.add("'" + groupColumn + "', " + groupColumn);
        }
        aggregates.forEach((alias, expr) -> args.add("'" + alias + "', " + expr));
        String jsonArgs = String.join(", ", args);

        if (groupColumn == null) {
            return StatsQueries.single(jsonArgs, List.of(), table.table(), where);
        }
        Map<String, String> sortable = StatsQueries.sortable(groupColumn, groupColumn);
        sortable.putAll(aggregates);
        String fallback = aggregates.values().iterator().next() + " DESC";
        return StatsQueries.grouped(
                jsonArgs, List.of(), table.table(), where, groupColumn, StatsQueries.orderBy(plan, sortable, fallback), plan);
    }

    private static String aggregate(EntityTable table, String fn, String arg) {
        boolean all = arg.isEmpty() || arg.equals("*");
        switch (fn) {
            case "count":
                return all ? "COUNT(*)" : "COUNT(" + column(table, arg).column() + ")";
            case "group_uniq_array": {
                if (all) {
                    throw new InvalidRequestException("group_uniq_array requires a field");
                }
                String col = column(table, arg).column();
                return "coalesce(jsonb_agg(DISTINCT " + col + ") FILTER (WHERE " + col + " IS NOT NULL), '[]'::jsonb)";
            }
            case "sum", "avg", "min", "max": {
                if (all) {
                    throw new InvalidRequestException(fn + " requires a field");
                }
                ColumnHandler handler = column(table, arg);
                if (handler.kind() != ValueKind.INTEGER && handler.kind() != ValueKind.FLOAT) {
                    throw new InvalidRequestException(fn + " requires a numeric field, got '" + arg + "'");
                }
                return fn.toUpperCase(Locale.ROOT) + "(" + handler.column() + ")";
            }
            default:
                throw new InvalidRequestException("unsupported stats function '" + fn + "' for " + table.entityLabel());
        }
    }

    private static ColumnHandler column(EntityTable table, String field) {
        if (!table.filterFields().contains(field)) {
            throw new InvalidRequestException("unsupported stats field for " + table.entityLabel() + ": '" + field + "'");
        }
        return table.handler(field);
    }
}
