package com.serviceradar.srql.service.core.sql;

/** How rows coming back from a compiled query become JSON results. */
public enum ResultShape {
    /** One JSON object per row, keyed by column name. */
    ROWS,
    /** One JSON value per row, taken from the {@code payload} column; null payloads are dropped. */
    PAYLOAD,
    /** Exactly one result: the first row's {@code payload}, or an empty object. */
    SINGLE_PAYLOAD
}
