package com.serviceradar.srql.service.core.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.serviceradar.srql.service.core.PlanFixtures;
import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.DownsampleAgg;
import com.serviceradar.srql.service.core.parser.DownsampleSpec;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.FilterOp;
import com.serviceradar.srql.service.core.parser.FilterValue;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.time.TimeRange;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

/**
 * Compiles every whitelisted field of every table planner with each of its operators, scalar and
 * list shaped, alone and combined, and checks that the positional parameters run 1..n over the
 * binds.
 */
class PlannerFilterSweepTest {

    private static final TimeRange LAST_HOUR =
            new TimeRange(PlanFixtures.NOW.minus(Duration.ofHours(1)), PlanFixtures.NOW);

    private final PlannerRegistry registry = new PlannerRegistry();

    @Test
    void everyFieldAndOperatorCompilesWithContiguousParameters() {
        int compiled = 0;
        for (TablePlanner planner : tablePlanners()) {
            EntityTable table = planner.table();
            for (Entity entity : planner.entities()) {
                for (String field : table.filterFields()) {
                    for (Filter filter : filtersFor(field, table.handler(field))) {
                        assertContiguous(compile(entity, List.of(filter), null), entity + " " + filter);
                        compiled++;
                    }
                }
            }
        }
        assertThat(compiled).isGreaterThan(100);
    }

    @Test
    void allFieldsCombinedCompileWithContiguousParameters() {
        for (TablePlanner planner : tablePlanners()) {
            EntityTable table = planner.table();
            for (Entity entity : planner.entities()) {
                List<Filter> filters = new ArrayList<>();
                for (String field : table.filterFields()) {
                    filters.addAll(filtersFor(field, table.handler(field)));
                }
                assertContiguous(compile(entity, filters, null), entity + " combined");
            }
        }
    }

    @Test
    void downsampleAcceptsEveryFieldOfItsSource() {
        for (EntityPlanner planner : PlannerRegistry.defaultPlanners()) {
            if (!(planner instanceof DownsampleSourceProvider provider)) {
                continue;
            }
            for (Entity entity : planner.entities()) {
                EntityTable table = provider.downsampleSource(entity).table();
                List<Filter> filters = new ArrayList<>();
                for (String field : table.filterFields()) {
                    filters.addAll(filtersFor(field, table.handler(field)));
                }
                DownsampleSpec spec = new DownsampleSpec(300, DownsampleAgg.AVG, null);
                assertContiguous(compile(entity, filters, spec), entity + " downsample");
            }
        }
    }

    @Test
    void operatorsOutsideAFieldsWhitelistAreRejected() {
        for (TablePlanner planner : tablePlanners()) {
            EntityTable table = planner.table();
            Entity entity = planner.entities().iterator().next();
            for (String field : table.filterFields()) {
                ColumnHandler handler = table.handler(field);
                for (FilterOp op : FilterOp.values()) {
                    if (handler.ops().contains(op)) {
                        continue;
                    }
                    Filter filter = new Filter(field, op, valueFor(handler, op));
                    assertThatThrownBy(() -> compile(entity, List.of(filter), null))
                            .as(entity + " " + filter)
                            .isInstanceOf(InvalidRequestException.class);
                }
            }
        }
    }

    private CompiledQuery compile(Entity entity, List<Filter> filters, DownsampleSpec downsample) {
        QueryPlan plan = new QueryPlan(entity, filters, List.of(), 50, 100, LAST_HOUR, null, downsample, null);
        return registry.compile(plan);
    }

    private static List<TablePlanner> tablePlanners() {
        return PlannerRegistry.defaultPlanners().stream()
                .filter(TablePlanner.class::isInstance)
                .map(TablePlanner.class::cast)
                .collect(Collectors.toList());
    }

    /** One filter per allowed operator, plus an empty list for each list operator. */
    private static List<Filter> filtersFor(String field, ColumnHandler handler) {
        List<Filter> filters = new ArrayList<>();
        for (FilterOp op : handler.ops()) {
            filters.add(new Filter(field, op, valueFor(handler, op)));
            if (op.isList()) {
                filters.add(new Filter(field, op, new FilterValue.ListValue(List.of())));
            }
        }
        return filters;
    }

    private static FilterValue valueFor(ColumnHandler handler, FilterOp op) {
        String literal = switch (handler.kind()) {
            case INTEGER -> "7";
            case FLOAT -> "1.5";
            case BOOLEAN -> "true";
            case TEXT, TEXT_ARRAY_CONTAINS, TEXT_ARRAY_OVERLAP -> op == FilterOp.LIKE || op == FilterOp.NOT_LIKE
                    ? "%core%"
                    : "core";
        };
        return op.isList() ? new FilterValue.ListValue(List.of(literal, literal)) : new FilterValue.Scalar(literal);
    }

    private static void assertContiguous(CompiledQuery query, String description) {
        List<Integer> expected = IntStream.rangeClosed(1, query.binds().size()).boxed().collect(Collectors.toList());
        assertThat(PlanFixtures.positionalIndexes(query.positionalSql()))
                .as(description)
                .isEqualTo(expected);
    }
}
