package com.serviceradar.srql.service.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.serviceradar.srql.service.core.parser.QueryAst;
import com.serviceradar.srql.service.core.parser.SrqlParser;
import com.serviceradar.srql.service.core.plan.PaginationMeta;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.plan.QueryPlanAssembler;
import com.serviceradar.srql.service.core.plan.QueryRequest;
import com.serviceradar.srql.service.core.planner.PlannerRegistry;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Entry point: parse, plan and compile an SRQL query, then either run it or return the SQL. */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryEngine {

    private final SrqlParser parser = new SrqlParser();
    private final QueryPlanAssembler assembler;
    private final PlannerRegistry planners;
    private final QueryExecutor executor;
    private final ResultMapper resultMapper;

    public QueryResponse executeQuery(QueryRequest request) {
        Compiled compiled = compile(request);
        List<Map<String, Object>> rows = executor.execute(compiled.query());
        List<JsonNode> results = resultMapper.map(rows, compiled.query().shape());
        QueryPlan plan = compiled.plan();
        return new QueryResponse(results, PaginationMeta.afterFetch(plan.offset(), plan.limit(), rows.size()));
    }

    public TranslateResponse translate(QueryRequest request) {
        Compiled compiled = compile(request);
        QueryPlan plan = compiled.plan();
        return new TranslateResponse(
                compiled.query().positionalSql(),
                compiled.query().binds(),
                PaginationMeta.forTranslation(plan.offset(), plan.limit()));
    }

    private Compiled compile(QueryRequest request) {
        QueryAst ast = parser.parse(request.query());
        QueryPlan plan = assembler.assemble(ast, request);
        CompiledQuery query = planners.compile(plan);
        log.debug("SRQL '{}' compiled for {} (limit={}, offset={})", request.query(), plan.entity().label(), plan.limit(), plan.offset());
        return new Compiled(plan, query);
    }

    private record Compiled(QueryPlan plan, CompiledQuery query) {}
}
