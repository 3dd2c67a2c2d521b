package com.serviceradar.srql.service.core.plan;

public record PaginationMeta(String nextCursor, String prevCursor, Long limit) {

    /** After execution: a next page is offered only when this page came back full. */
    public static PaginationMeta afterFetch(long offset, long limit, int fetched) {
        String next = fetched >= limit ? nextCursor(offset, limit) : null;
        String prev = offset > 0 ? CursorCodec.encode(Math.max(0, offset - limit)) : null;
        return new PaginationMeta(next, prev, limit);
    }

    /** Without execution the row count is unknown, so a next cursor is always offered. */
    public static PaginationMeta forTranslation(long offset, long limit) {
        String prev = offset > 0 ? CursorCodec.encode(Math.max(0, offset - limit)) : null;
        return new PaginationMeta(nextCursor(offset, limit), prev, limit);
    }

    /** Null when the next offset would not fit in a long. */
    private static String nextCursor(long offset, long limit) {
        try {
            return CursorCodec.encode(Math.addExact(offset, limit));
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
