package com.serviceradar.srql.service.core.sql;

/** Storage type of a filterable column; selects literal parsing and clause rendering. */
public enum ValueKind {
    TEXT,
    INTEGER,
    FLOAT,
    BOOLEAN,
    /** {@code text[]} column matched with {@code @>}. */
    TEXT_ARRAY_CONTAINS,
    /** {@code text[]} column matched with {@code &&}. */
    TEXT_ARRAY_OVERLAP
}
