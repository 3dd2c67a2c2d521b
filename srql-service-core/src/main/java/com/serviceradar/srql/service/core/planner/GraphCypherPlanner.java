package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.FilterOp;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only openCypher against the Apache AGE graph, e.g.
 * {@code in:graph_cypher cypher:"MATCH (d:Device)-[e]->(n) RETURN d, e, n"}.
 *
 * Each result becomes a {@code {nodes, edges}} topology payload unless it already is one.
 */
public class GraphCypherPlanner implements EntityPlanner {

    static final String GRAPH = "serviceradar";

    private static final Pattern MUTATION = Pattern.compile(
            "\\b(CREATE|MERGE|DELETE|DETACH|SET|REMOVE|DROP|CALL|LOAD)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"");

    @Override
    public Set<Entity> entities() {
        return Set.of(Entity.GRAPH_CYPHER);
    }

    @Override
    public CompiledQuery compile(QueryPlan plan) {
        if (plan.entity() != Entity.GRAPH_CYPHER) {
            throw new InvalidRequestException("entity '" + plan.entity().label() + "' is not handled by the graph_cypher planner");
        }
        if (plan.stats() != null || plan.rollupStats() != null) {
            throw new InvalidRequestException("stats are not supported for graph_cypher");
        }

        String cypher = null;
        for (Filter filter : plan.filters()) {
            if (!filter.field().equals("cypher")) {
                throw new InvalidRequestException("unsupported filter field for graph_cypher: '" + filter.field() + "'");
            }
            if (filter.op() != FilterOp.EQ && filter.op() != FilterOp.LIKE) {
                throw new InvalidRequestException("cypher filter only supports equality");
            }
            cypher = filter.value().asScalar().trim();
        }
        if (cypher == null || cypher.isEmpty()) {
            throw new InvalidRequestException("graph_cypher queries require cypher:\"<query>\"");
        }
        validateReadOnly(cypher);

        String sql = "SELECT CASE"
                + "\n    WHEN jsonb_typeof(r.result) = 'object' AND jsonb_exists(r.result, 'nodes') THEN r.result"
                + "\n    ELSE jsonb_build_object('nodes', jsonb_build_array(r.result), 'edges', '[]'::jsonb)"
                + "\n  END AS payload"
                + "\nFROM ("
                + "\n  SELECT result::text::jsonb AS result"
                + "\n  FROM ag_catalog.cypher('" + GRAPH + "', $$ " + cypher + " $$) AS (result ag_catalog.agtype)"
                + "\n) r"
                + "\nLIMIT ? OFFSET ?";
        return new CompiledQuery(
                sql, List.of(new BindParam.Int(plan.limit()), new BindParam.Int(plan.offset())), ResultShape.PAYLOAD);
    }

    static void validateReadOnly(String cypher) {
        if (cypher.contains("$$")) {
            throw new InvalidRequestException("cypher query must not contain '$$'");
        }
        String unquoted = STRING_LITERAL.matcher(cypher).replaceAll("''");
        if (MUTATION.matcher(unquoted).find()) {
            throw new InvalidRequestException("graph_cypher queries must be read-only");
        }
    }
}
