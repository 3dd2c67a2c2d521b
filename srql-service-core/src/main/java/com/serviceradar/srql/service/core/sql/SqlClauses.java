package com.serviceradar.srql.service.core.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Accumulates AND-ed predicates together with their binds, in placeholder order. */
public final class SqlClauses {

    private final List<String> clauses = new ArrayList<>();
    private final List<BindParam> binds = new ArrayList<>();

    public SqlClauses add(String clause, BindParam... params) {
        clauses.add(clause);
        Collections.addAll(binds, params);
        return this;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public List<String> clauses() {
        return List.copyOf(clauses);
    }

    public List<BindParam> binds() {
        return List.copyOf(binds);
    }

    /** {@code "\nWHERE a AND b"}, or an empty string when there is nothing to filter on. */
    public String render() {
        if (clauses.isEmpty()) {
            return "";
        }
        return "\nWHERE " + String.join(" AND ", clauses);
    }
}
