package com.serviceradar.srql.service.core.plan;

/**
 * A query submission. {@code limit} overrides any {@code limit:} token; {@code cursor} is the opaque
 * value returned in a previous response's pagination block.
 */
public record QueryRequest(String query, Long limit, String cursor) {

    public static QueryRequest of(String query) {
        return new QueryRequest(query, null, null);
    }
}
