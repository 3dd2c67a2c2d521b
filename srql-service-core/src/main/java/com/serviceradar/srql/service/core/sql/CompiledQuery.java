package com.serviceradar.srql.service.core.sql;

import com.serviceradar.srql.service.core.error.InternalQueryException;
import java.util.List;

/**
 * Output of every planner: SQL with {@code ?} placeholders, one bind per placeholder in order, and
 * the result shape. Both execution and translation consume this object, so the placeholder count is
 * checked once here.
 */
public record CompiledQuery(String sql, List<BindParam> binds, ResultShape shape) {

    public CompiledQuery {
        binds = List.copyOf(binds);
        int placeholders = SqlPlaceholders.count(sql);
        if (placeholders != binds.size()) {
            throw new InternalQueryException("bind count mismatch: " + placeholders + " placeholders, "
                    + binds.size() + " binds for SQL:\n" + sql);
        }
    }

    /** SQL with {@code $n} placeholders, as shown to callers of translate. */
    public String positionalSql() {
        return SqlPlaceholders.toPositional(sql);
    }
}
