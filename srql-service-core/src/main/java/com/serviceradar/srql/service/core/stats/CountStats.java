package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code count() [as alias]} with no grouping. */
public final class CountStats {

    private static final Pattern COUNT = Pattern.compile("^count\\( ?\\*? ?\\)(?: as (\\S+))?$");

    private CountStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where) {
        Matcher m = COUNT.matcher(StatsQueries.normalize(expression));
        if (!m.matches()) {
            throw new InvalidRequestException(table.entityLabel() + " stats only support count()");
        }
        String alias = StatsQueries.sanitizeAlias(m.group(1) == null ? "count" : m.group(1));
        return StatsQueries.single("'" + alias + "', COUNT(*)", List.of(), table.table(), where);
    }
}
