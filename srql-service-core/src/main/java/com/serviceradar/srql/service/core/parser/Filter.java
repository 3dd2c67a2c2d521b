package com.serviceradar.srql.service.core.parser;

import java.util.Locale;

/** A single {@code field op value} predicate. The lower-cased field is what entity whitelists match. */
public record Filter(String field, FilterOp op, FilterValue value) {

    public Filter withField(String newField) {
        return new Filter(newField, op, value);
    }

    /**
     * Infers the operator from the key and value shape: a leading {@code !} on the key negates,
     * {@code >=}, {@code >}, {@code <=}, {@code <} prefixes select a range, {@code %} selects a
     * pattern match and a list selects membership.
     */
    public static Filter of(String key, FilterValue value) {
        String field = key.trim();
        boolean negated = false;
        if (field.startsWith("!")) {
            field = field.substring(1);
            negated = true;
        }

        FilterOp op;
        FilterValue effective = value;
        if (value instanceof FilterValue.ListValue) {
            op = FilterOp.IN;
        } else {
            String raw = value.asScalar();
            if (raw.startsWith(">=")) {
                op = FilterOp.GTE;
                effective = new FilterValue.Scalar(raw.substring(2).trim());
            } else if (raw.startsWith("<=")) {
                op = FilterOp.LTE;
                effective = new FilterValue.Scalar(raw.substring(2).trim());
            } else if (raw.startsWith(">")) {
                op = FilterOp.GT;
                effective = new FilterValue.Scalar(raw.substring(1).trim());
            } else if (raw.startsWith("<")) {
                op = FilterOp.LT;
                effective = new FilterValue.Scalar(raw.substring(1).trim());
            } else if (raw.contains("%")) {
                op = FilterOp.LIKE;
            } else {
                op = FilterOp.EQ;
            }
        }
        if (negated) {
            op = op.negate();
        }
        return new Filter(field.toLowerCase(Locale.ROOT), op, effective);
    }
}
