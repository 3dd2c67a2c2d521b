package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.List;

/** CPU utilisation per device: exactly {@code avg(usage_percent) as <alias> by device_id}. */
public final class DeviceAverageStats {

    private static final String AGGREGATE = "AVG(usage_percent)";

    private DeviceAverageStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where, QueryPlan plan) {
        String normalized = StatsQueries.normalize(expression);
        if (normalized.contains(",")) {
            throw new InvalidRequestException("cpu metrics stats only support a single expression");
        }
        int by = normalized.lastIndexOf(" by ");
        if (by < 0) {
            throw new InvalidRequestException("stats expression must include 'by device_id'");
        }
        if (!normalized.substring(by + 4).trim().equals("device_id")) {
            throw new InvalidRequestException("cpu metrics stats only support grouping by device_id");
        }
        String head = normalized.substring(0, by).trim();
        int as = head.lastIndexOf(" as ");
        if (as < 0) {
            throw new InvalidRequestException("stats expression must include an alias");
        }
        if (!head.substring(0, as).replace(" ", "").equals("avg(usage_percent)")) {
            throw new InvalidRequestException("cpu metrics stats only support avg(usage_percent)");
        }
        String alias = StatsQueries.sanitizeAlias(head.substring(as + 4));

        String orderBy = StatsQueries.orderBy(
                plan, StatsQueries.sortable("device_id", "device_id", alias, AGGREGATE), AGGREGATE + " DESC");
        return StatsQueries.grouped(
                "'device_id', device_id, '" + alias + "', " + AGGREGATE,
                List.of(),
                table.table(),
                where,
                "device_id",
                orderBy,
                plan);
    }
}
