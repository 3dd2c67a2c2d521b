package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import java.util.Set;

/** Compiles a {@link QueryPlan} for one entity family into parameterized SQL. Implementations are stateless. */
public interface EntityPlanner {

    Set<Entity> entities();

    CompiledQuery compile(QueryPlan plan);
}
