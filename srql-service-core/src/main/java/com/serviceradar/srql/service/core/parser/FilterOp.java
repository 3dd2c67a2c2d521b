package com.serviceradar.srql.service.core.parser;

public enum FilterOp {
    EQ,
    NOT_EQ,
    LIKE,
    NOT_LIKE,
    IN,
    NOT_IN,
    GT,
    GTE,
    LT,
    LTE;

    public boolean isList() {
        return this == IN || this == NOT_IN;
    }

    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    public boolean isNegated() {
        return this == NOT_EQ || this == NOT_LIKE || this == NOT_IN;
    }

    /** The operator selected by a leading {@code !} on the field. */
    public FilterOp negate() {
        return switch (this) {
            case EQ -> NOT_EQ;
            case NOT_EQ -> EQ;
            case LIKE -> NOT_LIKE;
            case NOT_LIKE -> LIKE;
            case IN -> NOT_IN;
            case NOT_IN -> IN;
            case GT -> LTE;
            case GTE -> LT;
            case LT -> GTE;
            case LTE -> GT;
        };
    }
}
