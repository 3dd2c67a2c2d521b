package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.OrderClause;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/** SQL assembly shared by the stats grammars. Every stats query yields a jsonb {@code payload} column. */
public final class StatsQueries {

    public static final int MAX_EXPRESSIONS = 25;

    private static final Pattern ALIAS = Pattern.compile("[a-z0-9_]+");

    private StatsQueries() {}

    /** Trimmed, lower-cased alias limited to {@code [a-z0-9_]}; it ends up inside a SQL string literal. */
    public static String sanitizeAlias(String raw) {
        String alias = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (!ALIAS.matcher(alias).matches()) {
            throw new InvalidRequestException("stats alias must be alphanumeric");
        }
        return alias;
    }

    /** Ungrouped aggregate: a single payload row, no paging. */
    public static CompiledQuery single(String jsonArgs, List<BindParam> selectBinds, String table, SqlClauses where) {
        String sql = "SELECT jsonb_build_object(" + jsonArgs + ") AS payload"
                + "\nFROM " + table
                + where.render();
        List<BindParam> binds = new ArrayList<>(selectBinds);
        binds.addAll(where.binds());
        return new CompiledQuery(sql, binds, ResultShape.SINGLE_PAYLOAD);
    }

    /** Grouped aggregate: one payload per group, ordered and paged. */
    public static CompiledQuery grouped(
            String jsonArgs,
            List<BindParam> selectBinds,
            String table,
            SqlClauses where,
            String groupBy,
            String orderBy,
            QueryPlan plan) {
        String sql = "SELECT jsonb_build_object(" + jsonArgs + ") AS payload"
                + "\nFROM " + table
                + where.render()
                + "\nGROUP BY " + groupBy
                + "\nORDER BY " + orderBy
                + "\nLIMIT ? OFFSET ?";
        List<BindParam> binds = new ArrayList<>(selectBinds);
        binds.addAll(where.binds());
        binds.add(new BindParam.Int(plan.limit()));
        binds.add(new BindParam.Int(plan.offset()));
        return new CompiledQuery(sql, binds, ResultShape.PAYLOAD);
    }

    /**
     * ORDER BY terms for a grouped query. {@code orderable} maps sortable names (aliases, group
     * column) to SQL expressions; unknown names are skipped.
     */
    public static String orderBy(QueryPlan plan, Map<String, String> orderable, String fallback) {
        List<String> parts = new ArrayList<>();
        for (OrderClause clause : plan.order()) {
            String expr = orderable.get(clause.field());
            if (expr != null) {
                parts.add(expr + " " + clause.direction().sql());
            }
        }
        return parts.isEmpty() ? fallback : String.join(", ", parts);
    }

    /** Name-to-expression pairs for {@link #orderBy}; later pairs win on a name clash. */
    public static Map<String, String> sortable(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    /** Collapses runs of whitespace and lower-cases, so grammars can match on a canonical form. */
    static String normalize(String expression) {
        return expression.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
