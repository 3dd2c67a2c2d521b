package com.serviceradar.srql.service.core.stats;

/** Aggregation dialects accepted by {@code stats:}. Each entity planner declares exactly one. */
public enum StatsGrammar {
    /** {@code count() [as alias]}. */
    COUNT_ONLY,
    /** {@code count() as alias [by service_name]}. */
    COUNT_BY_SERVICE,
    /** {@code avg(usage_percent) as alias by device_id}. */
    AVG_BY_DEVICE,
    /** {@code count() as a, group_uniq_array(field) as b, ... [by field]}. */
    MULTI_AGGREGATE,
    /** Up to 25 of {@code count()}, {@code sum(if(<condition>, 1, 0))}, returning one payload. */
    CONDITIONAL_SUMS,
    /** {@code sum|avg|min|max|count(field) as alias [by field]}. */
    AGG_BY_FIELD
}
