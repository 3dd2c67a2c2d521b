package com.serviceradar.srql.service.core.parser;

/** One {@code fn(field) as alias} term of a stats expression. Field is null for {@code count()}. */
public record StatsAggregation(Type type, String field, String alias) {

    public enum Type {
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX
    }
}
