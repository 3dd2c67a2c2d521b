package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.util.Locale;

public enum DownsampleAgg {
    AVG,
    MIN,
    MAX,
    SUM,
    COUNT;

    public static DownsampleAgg parse(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "avg", "mean" -> AVG;
            case "min" -> MIN;
            case "max" -> MAX;
            case "sum" -> SUM;
            case "count" -> COUNT;
            default -> throw new InvalidRequestException("unsupported agg '" + raw + "'");
        };
    }

    /** Aggregate over {@code valueColumn}; counts are cast so every series carries a double. */
    public String sql(String valueColumn) {
        return switch (this) {
            case AVG -> "avg(" + valueColumn + ")";
            case MIN -> "min(" + valueColumn + ")";
            case MAX -> "max(" + valueColumn + ")";
            case SUM -> "sum(" + valueColumn + ")";
            case COUNT -> "COUNT(*)::double precision";
        };
    }
}
