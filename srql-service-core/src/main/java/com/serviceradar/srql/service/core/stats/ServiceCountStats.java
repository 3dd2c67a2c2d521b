package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code count() as alias [by service_name]}; the grouped form pages over services. */
public final class ServiceCountStats {

    private static final Pattern EXPRESSION = Pattern.compile("^count\\( ?\\*? ?\\)(?: as (\\S+))?(?: by (\\S+))?$");
    private static final Set<String> SERVICE_FIELDS = Set.of("service_name", "service", "name");

    private ServiceCountStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where, QueryPlan plan) {
        Matcher m = EXPRESSION.matcher(StatsQueries.normalize(expression));
        if (!m.matches()) {
            throw new InvalidRequestException(table.entityLabel() + " stats only support count()");
        }
        if (m.group(1) == null) {
            throw new InvalidRequestException("stats expression must include an alias");
        }
        String alias = StatsQueries.sanitizeAlias(m.group(1));
        String groupBy = m.group(2);
        if (groupBy == null) {
            return StatsQueries.single("'" + alias + "', COUNT(*)", List.of(), table.table(), where);
        }
        if (!SERVICE_FIELDS.contains(groupBy)) {
            throw new InvalidRequestException(table.entityLabel() + " stats only support grouping by service_name");
        }
        String orderBy = StatsQueries.orderBy(
                plan, StatsQueries.sortable("service_name", "service_name", alias, "COUNT(*)"), "COUNT(*) DESC");
        return StatsQueries.grouped(
                "'service_name', service_name, '" + alias + "', COUNT(*)",
                List.of(),
                table.table(),
                where,
                "service_name",
                orderBy,
                plan);
    }
}
