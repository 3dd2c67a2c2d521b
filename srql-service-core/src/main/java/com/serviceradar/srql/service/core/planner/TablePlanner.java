package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import com.serviceradar.srql.service.core.stats.ConditionalSumStats;
import com.serviceradar.srql.service.core.stats.CountStats;
import com.serviceradar.srql.service.core.stats.DeviceAverageStats;
import com.serviceradar.srql.service.core.stats.FieldAggregateStats;
import com.serviceradar.srql.service.core.stats.MultiAggregateStats;
import com.serviceradar.srql.service.core.stats.ServiceCountStats;
import com.serviceradar.srql.service.core.stats.StatsGrammar;
import java.util.EnumSet;
import java.util.Set;

/**
 * Planner over a single table described by an {@link EntityTable}. Routes a plan to the rollup,
 * stats or row path; subclasses supply the table, the stats grammar and any forced predicates.
 */
public abstract class TablePlanner implements EntityPlanner {

    protected final EntityTable table;
    private final StatsGrammar statsGrammar;
    private final Set<Entity> entities;

    protected TablePlanner(EntityTable table, StatsGrammar statsGrammar, Entity first, Entity... rest) {
        this.table = table;
        this.statsGrammar = statsGrammar;
        this.entities = EnumSet.of(first, rest);
    }

    @Override
    public Set<Entity> entities() {
        return entities;
    }

    public EntityTable table() {
        return table;
    }

    public StatsGrammar statsGrammar() {
        return statsGrammar;
    }

    @Override
    public CompiledQuery compile(QueryPlan plan) {
        ensureEntity(plan);
        if (plan.rollupStats() != null) {
            return compileRollup(plan);
        }
        if (plan.stats() != null) {
            return compileStats(plan);
        }
        return compileRows(plan);
    }

    protected void ensureEntity(QueryPlan plan) {
        if (!entities.contains(plan.entity())) {
            throw new InvalidRequestException(
                    "entity '" + plan.entity().label() + "' is not handled by the " + table.entityLabel() + " planner");
        }
    }

    /** Predicates the caller cannot see or override, placed after the time range and before user filters. */
    protected void forcedClauses(QueryPlan plan, SqlClauses where) {}

    protected SqlClauses where(QueryPlan plan, boolean qualified) {
        return table.where(plan, qualified, clauses -> forcedClauses(plan, clauses));
    }

    protected CompiledQuery compileRows(QueryPlan plan) {
        return table.selectRows(plan, where(plan, true));
    }

    protected CompiledQuery compileRollup(QueryPlan plan) {
        throw new InvalidRequestException("rollup_stats is not supported for " + plan.entity().label());
    }

    protected CompiledQuery compileStats(QueryPlan plan) {
        String expression = plan.stats().expression();
        return switch (statsGrammar) {
            case COUNT_ONLY -> CountStats.compile(table, expression, where(plan, false));
            case COUNT_BY_SERVICE -> ServiceCountStats.compile(table, expression, where(plan, false), plan);
            case AVG_BY_DEVICE -> DeviceAverageStats.compile(table, expression, where(plan, false), plan);
            case MULTI_AGGREGATE -> MultiAggregateStats.compile(table, expression, where(plan, false), plan);
            case CONDITIONAL_SUMS -> ConditionalSumStats.compile(table, expression, where(plan, false));
            case AGG_BY_FIELD -> FieldAggregateStats.compile(table, expression, where(plan, false), plan);
        };
    }
}
