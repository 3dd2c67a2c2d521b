package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.DownsampleSpec;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-bucketed aggregation for any metric entity, always yielding rows of
 * {@code timestamp, series, value}.
 */
public final class DownsamplePlanner {

    public CompiledQuery compile(QueryPlan plan, DownsampleSource source) {
        DownsampleSpec spec = plan.downsample();
        if (spec == null) {
            throw new InvalidRequestException("downsample requires bucket:<duration>");
        }
        if (plan.timeRange() == null) {
            throw new InvalidRequestException("downsample queries require time:<range>");
        }
        if (plan.stats() != null || plan.rollupStats() != null) {
            throw new InvalidRequestException("downsample cannot be combined with stats");
        }

        String seriesExpr = "NULL::text";
        if (spec.series() != null) {
            String column = source.series().get(spec.series());
            if (column == null) {
                throw new InvalidRequestException(
                        "unsupported series field '" + spec.series() + "' for " + source.table().table());
            }
            seriesExpr = "coalesce(" + column + ", '')";
        }

        String ts = source.timestampColumn();
        SqlClauses where = new SqlClauses();
        where.add(ts + " >= ?", BindParam.Timestamptz.of(plan.timeRange().start()));
        where.add(ts + " <= ?", BindParam.Timestamptz.of(plan.timeRange().end()));
        if (source.forcedMetricType() != null) {
            where.add("metric_type = ?", new BindParam.Text(source.forcedMetricType()));
        }
        plan.filters().forEach(filter -> {
            if (!source.table().filterFields().contains(filter.field())) {
                throw new InvalidRequestException("unsupported filter field for downsample "
                        + source.table().table() + ": '" + filter.field() + "'");
            }
            source.table().applyFilter(filter, where, false);
        });

        String sql = "SELECT time_bucket(make_interval(secs => " + spec.bucketSeconds() + "), " + ts + ") AS timestamp, "
                + seriesExpr + " AS series, "
                + spec.agg().sql(source.valueColumn()) + " AS value"
                + "\nFROM " + source.table().table()
                + where.render()
                + "\nGROUP BY 1, 2"
                + "\nORDER BY 1 ASC"
                + "\nLIMIT ? OFFSET ?";
        List<BindParam> binds = new ArrayList<>(where.binds());
        binds.add(new BindParam.Int(plan.limit()));
        binds.add(new BindParam.Int(plan.offset()));
        return new CompiledQuery(sql, binds, ResultShape.ROWS);
    }
}
