package com.serviceradar.srql.service.core.sql;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.serviceradar.srql.service.core.PlanFixtures;
import com.serviceradar.srql.service.core.error.InternalQueryException;
import java.util.List;
import org.junit.jupiter.api.Test;

class SqlPlaceholdersTest {

    @Test
    void rewritesPlaceholdersInOrder() {
        String sql = "SELECT * FROM t WHERE a = ? AND b = ANY(?) LIMIT ? OFFSET ?";

        assertEquals(4, SqlPlaceholders.count(sql));
        assertEquals("SELECT * FROM t WHERE a = $1 AND b = ANY($2) LIMIT $3 OFFSET $4",
                SqlPlaceholders.toPositional(sql));
    }

    @Test
    void questionMarksInLiteralsAndDollarBodiesAreNotPlaceholders() {
        String sql = "SELECT '?', \"odd?\" FROM cypher('g', $$ MATCH (n {x: '?'}) RETURN n $$) LIMIT ?";

        assertEquals(1, SqlPlaceholders.count(sql));
        assertEquals("SELECT '?', \"odd?\" FROM cypher('g', $$ MATCH (n {x: '?'}) RETURN n $$) LIMIT $1",
                SqlPlaceholders.toPositional(sql));
    }

    @Test
    void dollarNumbersInsideCypherBodiesAreNotPositionalParameters() {
        String positional = SqlPlaceholders.toPositional(
                "SELECT * FROM cypher('g', $$ MATCH (n) WHERE n.cost = $1 RETURN n $$) AS (r agtype) LIMIT ?");

        assertEquals(List.of(1), PlanFixtures.positionalIndexes(positional));
    }

    @Test
    void compiledQueryRejectsMismatchedBinds() {
        assertThatThrownBy(() -> new CompiledQuery("SELECT ? , ?", List.of(new BindParam.Int(1)), ResultShape.ROWS))
                .isInstanceOf(InternalQueryException.class)
                .hasMessageStartingWith("bind count mismatch: 2 placeholders, 1 binds");
    }

    @Test
    void positionalSqlMatchesBindCount() {
        CompiledQuery query = new CompiledQuery(
                "SELECT * FROM t WHERE a = ? LIMIT ? OFFSET ?",
                List.of(new BindParam.Text("x"), new BindParam.Int(10), new BindParam.Int(0)),
                ResultShape.ROWS);

        assertEquals(List.of(1, 2, 3), PlanFixtures.positionalIndexes(query.positionalSql()));
    }
}
