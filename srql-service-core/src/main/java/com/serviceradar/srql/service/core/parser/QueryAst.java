package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.time.TimeFilterSpec;
import java.util.List;

/**
 * Parser output. Optional parts are null when the query does not mention them.
 */
public record QueryAst(
        Entity entity,
        List<Filter> filters,
        List<OrderClause> order,
        Long limit,
        TimeFilterSpec timeFilter,
        StatsSpec stats,
        DownsampleSpec downsample,
        String rollupStats) {

    public QueryAst {
        filters = List.copyOf(filters);
        order = List.copyOf(order);
    }
}
