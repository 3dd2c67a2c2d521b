package com.serviceradar.srql.service.core.engine;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.serviceradar.srql.service.core.error.InternalQueryException;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

class JdbcQueryExecutorTest {

    @Mock
    PreparedStatement ps;

    @Mock
    Connection connection;

    @Mock
    Array sqlArray;

    @Mock
    JdbcTemplate jdbc;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(ps.getConnection()).thenReturn(connection);
        when(connection.createArrayOf(anyString(), any())).thenReturn(sqlArray);
    }

    @Test
    void bindsEachParameterWithItsDeclaredType() throws Exception {
        JdbcQueryExecutor.bind(ps, List.of(
                new BindParam.Text("core"),
                new BindParam.TextArray(List.of("a")),
                new BindParam.Bool(true),
                new BindParam.Int(7),
                new BindParam.Float(1.5),
                new BindParam.Timestamptz("2025-06-01T12:00:00Z")));

        verify(ps).setString(1, "core");
        verify(connection).createArrayOf(eq("text"), any());
        verify(ps).setArray(2, sqlArray);
        verify(ps).setBoolean(3, true);
        verify(ps).setLong(4, 7L);
        verify(ps).setDouble(5, 1.5);
        verify(ps).setObject(6, OffsetDateTime.parse("2025-06-01T12:00:00Z"), Types.TIMESTAMP_WITH_TIMEZONE);
    }

    @Test
    void integerListsBindAsInt8Arrays() throws Exception {
        JdbcQueryExecutor.bind(ps, List.of(new BindParam.IntArray(List.of(6L, 17L))));

        verify(connection).createArrayOf(eq("int8"), any());
        verify(ps).setArray(1, sqlArray);
    }

    @Test
    @SuppressWarnings("unchecked")
    void dataAccessFailuresBecomeInternalErrors() {
        when(jdbc.query(anyString(), any(PreparedStatementSetter.class), any(RowMapper.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        JdbcQueryExecutor executor = new JdbcQueryExecutor(jdbc);
        CompiledQuery query = new CompiledQuery("SELECT 1", List.of(), ResultShape.ROWS);

        assertThatThrownBy(() -> executor.execute(query)).isInstanceOf(InternalQueryException.class);
    }
}
