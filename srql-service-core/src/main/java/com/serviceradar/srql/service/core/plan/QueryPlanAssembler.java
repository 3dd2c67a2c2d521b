package com.serviceradar.srql.service.core.plan;

import com.serviceradar.srql.service.core.config.SrqlProperties;
import com.serviceradar.srql.service.core.parser.DownsampleSpec;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.OrderClause;
import com.serviceradar.srql.service.core.parser.QueryAst;
import com.serviceradar.srql.service.core.time.TimeRange;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Merges a parsed query with request paging, configured limits and the resolved time window. */
@Component
@RequiredArgsConstructor
public class QueryPlanAssembler {

    private final SrqlProperties properties;
    private final Clock clock;

    public QueryPlan assemble(QueryAst ast, QueryRequest request) {
        long requested = request.limit() != null
                ? request.limit()
                : ast.limit() != null ? ast.limit() : properties.getDefaultLimit();
        long limit = Math.min(Math.max(requested, 1), properties.getMaxLimit());
        long offset = CursorCodec.decode(request.cursor());

        TimeRange timeRange = ast.timeFilter() == null ? null : ast.timeFilter().resolve(clock);

        Entity entity = ast.entity();
        List<Filter> filters = ast.filters().stream()
                .map(f -> f.withField(normalizeDeviceField(entity, f.field())))
                .toList();
        List<OrderClause> order = ast.order().stream()
                .map(o -> o.withField(normalizeDeviceField(entity, o.field())))
                .toList();
        DownsampleSpec downsample = ast.downsample();
        if (downsample != null && downsample.series() != null) {
            downsample = downsample.withSeries(normalizeDeviceField(entity, downsample.series()));
        }

        return new QueryPlan(
                entity, filters, order, limit, offset, timeRange, ast.stats(), downsample, ast.rollupStats());
    }

    /** Devices are keyed by {@code uid}; every other device-scoped table calls it {@code device_id}. */
    static String normalizeDeviceField(Entity entity, String field) {
        if (entity == Entity.AGENTS) {
            return field;
        }
        if (entity == Entity.DEVICES) {
            return field.equals("device_id") ? "uid" : field;
        }
        return field.equals("uid") ? "device_id" : field;
    }
}
