package com.serviceradar.srql.service.core.engine;

import com.serviceradar.srql.service.core.error.InternalQueryException;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.stereotype.Repository;

/**
 * JDBC executor over PostgreSQL. Each bind is set with the type its placeholder is declared with;
 * SQL is logged at debug level.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcQueryExecutor implements QueryExecutor {

    private final JdbcTemplate jdbc;

    @Override
    public List<Map<String, Object>> execute(CompiledQuery query) {
        if (log.isDebugEnabled()) {
            log.debug("SRQL SQL:\n{}\nparams: {}", query.sql(), query.binds());
        }
        PreparedStatementSetter setter = ps -> bind(ps, query.binds());
        try {
            return jdbc.query(query.sql(), setter, new ColumnMapRowMapper());
        } catch (DataAccessException e) {
            log.error("SRQL query failed: {}\nSQL:\n{}\nparams: {}", e.getMessage(), query.sql(), query.binds());
            throw new InternalQueryException("query execution failed", e);
        }
    }

    static void bind(PreparedStatement ps, List<BindParam> binds) throws SQLException {
        int index = 1;
        for (BindParam param : binds) {
            if (param instanceof BindParam.Text text) {
                ps.setString(index, text.value());
            } else if (param instanceof BindParam.TextArray array) {
                ps.setArray(index, ps.getConnection().createArrayOf("text", array.value().toArray()));
            } else if (param instanceof BindParam.IntArray array) {
                ps.setArray(index, ps.getConnection().createArrayOf("int8", array.value().toArray()));
            } else if (param instanceof BindParam.Bool bool) {
                ps.setBoolean(index, bool.value());
            } else if (param instanceof BindParam.Int integer) {
                ps.setLong(index, integer.value());
            } else if (param instanceof BindParam.Float number) {
                ps.setDouble(index, number.value());
            } else if (param instanceof BindParam.Timestamptz ts) {
                ps.setObject(index, OffsetDateTime.parse(ts.value()), Types.TIMESTAMP_WITH_TIMEZONE);
            }
            index++;
        }
    }
}
