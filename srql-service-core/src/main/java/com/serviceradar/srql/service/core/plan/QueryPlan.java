package com.serviceradar.srql.service.core.plan;

import com.serviceradar.srql.service.core.parser.DownsampleSpec;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.OrderClause;
import com.serviceradar.srql.service.core.parser.StatsSpec;
import com.serviceradar.srql.service.core.time.TimeRange;
import java.util.List;

/**
 * Fully resolved query handed to entity planners: the parsed clauses with a concrete time range,
 * limit and offset. Planners never see the raw AST.
 */
public record QueryPlan(
        Entity entity,
        List<Filter> filters,
        List<OrderClause> order,
        long limit,
        long offset,
        TimeRange timeRange,
        StatsSpec stats,
        DownsampleSpec downsample,
        String rollupStats) {

    public QueryPlan {
        filters = List.copyOf(filters);
        order = List.copyOf(order);
    }
}
