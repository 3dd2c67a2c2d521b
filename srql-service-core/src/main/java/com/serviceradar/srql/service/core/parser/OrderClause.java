package com.serviceradar.srql.service.core.parser;

public record OrderClause(String field, OrderDirection direction) {

    public OrderClause withField(String newField) {
        return new OrderClause(newField, direction);
    }
}
