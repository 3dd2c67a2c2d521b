package com.serviceradar.srql.service.core.parser;

import java.util.Locale;

public enum OrderDirection {
    ASC,
    DESC;

    /** Missing or unrecognized directions fall back to descending. */
    public static OrderDirection parse(String raw) {
        if (raw != null && raw.trim().toLowerCase(Locale.ROOT).equals("asc")) {
            return ASC;
        }
        return DESC;
    }

    public String sql() {
        return this == ASC ? "ASC" : "DESC";
    }
}
