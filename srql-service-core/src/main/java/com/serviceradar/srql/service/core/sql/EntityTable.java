package com.serviceradar.srql.service.core.sql;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.FilterOp;
import com.serviceradar.srql.service.core.parser.OrderClause;
import com.serviceradar.srql.service.core.parser.OrderDirection;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.time.TimeRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Static description of one queryable table: filter whitelist, sortable columns and default order.
 * Built once per planner and shared by its row, stats and downsample paths.
 */
public final class EntityTable {

    private final String entityLabel;
    private final String table;
    private final String timeColumn;
    private final String selectList;
    private final Map<String, ColumnHandler> filters;
    private final Map<String, String> orderColumns;
    private final List<OrderClause> defaultOrder;

    private EntityTable(Builder b) {
        this.entityLabel = b.entityLabel;
        this.table = b.table;
        this.timeColumn = b.timeColumn;
        this.selectList = b.selectList;
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(b.filters));
        this.orderColumns = Collections.unmodifiableMap(new LinkedHashMap<>(b.orderColumns));
        this.defaultOrder = List.copyOf(b.defaultOrder);
    }

    public static Builder builder(String entityLabel, String table) {
        return new Builder(entityLabel, table);
    }

    public String entityLabel() {
        return entityLabel;
    }

    public String table() {
        return table;
    }

    public String timeColumn() {
        return timeColumn;
    }

    public Set<String> filterFields() {
        return filters.keySet();
    }

    /** Double-quoted {@code "table"."column"} reference used by row queries. */
    public String qualified(String column) {
        return "\"" + table + "\".\"" + column + "\"";
    }

    public ColumnHandler handler(String field) {
        ColumnHandler handler = filters.get(field);
        if (handler == null) {
            throw new InvalidRequestException(
                    "unsupported filter field for " + entityLabel + ": '" + field + "'");
        }
        return handler;
    }

    public Optional<String> orderColumn(String field) {
        return Optional.ofNullable(orderColumns.get(field));
    }

    public SqlClauses where(QueryPlan plan, boolean qualified) {
        return where(plan, qualified, clauses -> {});
    }

    /**
     * Time range first, then {@code forced} predicates, then user filters: the order binds are
     * collected in.
     */
    public SqlClauses where(QueryPlan plan, boolean qualified, Consumer<SqlClauses> forced) {
        SqlClauses where = new SqlClauses();
        applyTimeRange(plan.timeRange(), where, qualified);
        forced.accept(where);
        for (Filter filter : plan.filters()) {
            applyFilter(filter, where, qualified);
        }
        return where;
    }

    public void applyTimeRange(TimeRange range, SqlClauses where, boolean qualified) {
        if (range == null || timeColumn == null) {
            return;
        }
        String column = qualified ? qualified(timeColumn) : timeColumn;
        where.add(column + " >= ?", BindParam.Timestamptz.of(range.start()));
        where.add(column + " <= ?", BindParam.Timestamptz.of(range.end()));
    }

    public void applyFilter(Filter filter, SqlClauses where, boolean qualified) {
        ColumnHandler handler = handler(filter.field());
        String expr = qualified ? qualified(handler.column()) : handler.column();
        handler.apply(filter, expr, where);
    }

    /** ORDER BY for the requested clauses; unknown fields are skipped, an empty result falls back to the default. */
    public String orderBy(List<OrderClause> requested, boolean qualified) {
        List<String> parts = new ArrayList<>();
        for (OrderClause clause : requested) {
            String column = orderColumns.get(clause.field());
            if (column != null) {
                parts.add((qualified ? qualified(column) : column) + " " + clause.direction().sql());
            }
        }
        if (parts.isEmpty()) {
            for (OrderClause clause : defaultOrder) {
                parts.add((qualified ? qualified(clause.field()) : clause.field()) + " " + clause.direction().sql());
            }
        }
        return parts.isEmpty() ? "" : "\nORDER BY " + String.join(", ", parts);
    }

    public CompiledQuery selectRows(QueryPlan plan) {
        return selectRows(plan, where(plan, true));
    }

    public CompiledQuery selectRows(QueryPlan plan, SqlClauses where) {
        String select = selectList != null ? selectList : "\"" + table + "\".*";
        String sql = "SELECT " + select
                + "\nFROM \"" + table + "\""
                + where.render()
                + orderBy(plan.order(), true)
                + "\nLIMIT ? OFFSET ?";
        List<BindParam> binds = new ArrayList<>(where.binds());
        binds.add(new BindParam.Int(plan.limit()));
        binds.add(new BindParam.Int(plan.offset()));
        return new CompiledQuery(sql, binds, ResultShape.ROWS);
    }

    public static final class Builder {
        private final String entityLabel;
        private final String table;
        private String timeColumn;
        private String selectList;
        private final Map<String, ColumnHandler> filters = new LinkedHashMap<>();
        private final Map<String, String> orderColumns = new LinkedHashMap<>();
        private final List<OrderClause> defaultOrder = new ArrayList<>();

        private Builder(String entityLabel, String table) {
            this.entityLabel = entityLabel;
            this.table = table;
        }

        public Builder timeColumn(String column) {
            this.timeColumn = column;
            return this;
        }

        /** Explicit projection for row queries; defaults to every column. */
        public Builder selectList(String projection) {
            this.selectList = projection;
            return this;
        }

        public Builder field(String column, ValueKind kind, Set<FilterOp> ops, String... aliases) {
            ColumnHandler handler = new ColumnHandler(column, kind, ops);
            filters.put(column, handler);
            for (String alias : aliases) {
                filters.put(alias, handler);
            }
            return this;
        }

        /** Field whose query name differs from its column, e.g. {@code device_type} on column {@code type}. */
        public Builder renamed(String name, String column, ValueKind kind, Set<FilterOp> ops) {
            filters.put(name, new ColumnHandler(column, kind, ops));
            return this;
        }

        public Builder text(String column, String... aliases) {
            return field(column, ValueKind.TEXT, ColumnHandler.TEXT_ALL, aliases);
        }

        public Builder texts(String... columns) {
            for (String column : columns) {
                text(column);
            }
            return this;
        }

        public Builder integer(String column, String... aliases) {
            return field(column, ValueKind.INTEGER, ColumnHandler.EQUALITY, aliases);
        }

        public Builder integerRange(String column, String... aliases) {
            return field(column, ValueKind.INTEGER, ColumnHandler.COMPARABLE, aliases);
        }

        public Builder decimal(String column, String... aliases) {
            return field(column, ValueKind.FLOAT, ColumnHandler.COMPARABLE, aliases);
        }

        public Builder bool(String column, String... aliases) {
            return field(column, ValueKind.BOOLEAN, ColumnHandler.EQUALITY, aliases);
        }

        public Builder order(String column, String... aliases) {
            orderColumns.put(column, column);
            for (String alias : aliases) {
                orderColumns.put(alias, column);
            }
            return this;
        }

        public Builder defaultOrder(String column, OrderDirection direction) {
            defaultOrder.add(new OrderClause(column, direction));
            return this;
        }

        public EntityTable build() {
            return new EntityTable(this);
        }
    }
}
