package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.util.List;

/** Right-hand side of a filter token: a single scalar or a parenthesized list. */
public sealed interface FilterValue permits FilterValue.Scalar, FilterValue.ListValue {

    default String asScalar() {
        if (this instanceof Scalar scalar) {
            return scalar.value();
        }
        throw new InvalidRequestException("expected scalar value");
    }

    default List<String> asList() {
        if (this instanceof ListValue list) {
            return list.values();
        }
        throw new InvalidRequestException("expected list value");
    }

    /** Scalars become one-element lists; used by columns that treat both shapes alike. */
    default List<String> asValues() {
        if (this instanceof ListValue list) {
            return list.values();
        }
        return List.of(((Scalar) this).value());
    }

    record Scalar(String value) implements FilterValue {}

    record ListValue(List<String> values) implements FilterValue {
        public ListValue {
            values = List.copyOf(values);
        }
    }
}
