package com.serviceradar.srql.service.core.sql;

import static com.serviceradar.srql.service.core.parser.FilterOp.EQ;
import static com.serviceradar.srql.service.core.parser.FilterOp.GT;
import static com.serviceradar.srql.service.core.parser.FilterOp.GTE;
import static com.serviceradar.srql.service.core.parser.FilterOp.IN;
import static com.serviceradar.srql.service.core.parser.FilterOp.LIKE;
import static com.serviceradar.srql.service.core.parser.FilterOp.LT;
import static com.serviceradar.srql.service.core.parser.FilterOp.LTE;
import static com.serviceradar.srql.service.core.parser.FilterOp.NOT_EQ;
import static com.serviceradar.srql.service.core.parser.FilterOp.NOT_IN;
import static com.serviceradar.srql.service.core.parser.FilterOp.NOT_LIKE;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.FilterOp;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Whitelist entry for one filterable column: which operators it accepts, how its literals parse and
 * what predicate it renders.
 */
public record ColumnHandler(String column, ValueKind kind, Set<FilterOp> ops) {

    public static final Set<FilterOp> EQUALITY = EnumSet.of(EQ, NOT_EQ);
    public static final Set<FilterOp> TEXT_SCALAR = EnumSet.of(EQ, NOT_EQ, LIKE, NOT_LIKE);
    public static final Set<FilterOp> TEXT_ALL = EnumSet.of(EQ, NOT_EQ, LIKE, NOT_LIKE, IN, NOT_IN);
    public static final Set<FilterOp> MEMBERSHIP = EnumSet.of(EQ, NOT_EQ, IN, NOT_IN);
    public static final Set<FilterOp> COMPARABLE = EnumSet.of(EQ, NOT_EQ, GT, GTE, LT, LTE);

    public ColumnHandler {
        ops = Set.copyOf(ops);
    }

    /** Validates the operator, parses the literal and appends the predicate on {@code expr}. */
    public void apply(Filter filter, String expr, SqlClauses out) {
        FilterOp op = filter.op();
        if (!ops.contains(op)) {
            throw unsupportedOperator(filter.field(), op);
        }
        switch (kind) {
            case TEXT -> applyText(filter, expr, out);
            case INTEGER -> applyInteger(filter, expr, out);
            case FLOAT -> {
                double value = parseFloat(filter.field(), filter.value().asScalar());
                out.add(expr + " " + comparison(op) + " ?", new BindParam.Float(value));
            }
            case BOOLEAN -> {
                boolean value = parseBoolean(filter.value().asScalar());
                String clause = op == EQ ? expr + " = ?" : expr + " IS DISTINCT FROM ?";
                out.add(clause, new BindParam.Bool(value));
            }
            case TEXT_ARRAY_CONTAINS -> applyArray(filter, expr, "@>", out);
            case TEXT_ARRAY_OVERLAP -> applyArray(filter, expr, "&&", out);
        }
    }

    private static void applyText(Filter filter, String expr, SqlClauses out) {
        switch (filter.op()) {
            case EQ -> out.add(expr + " = ?", new BindParam.Text(filter.value().asScalar()));
            case NOT_EQ -> out.add(expr + " <> ?", new BindParam.Text(filter.value().asScalar()));
            case LIKE -> out.add(expr + " ILIKE ?", new BindParam.Text(filter.value().asScalar()));
            case NOT_LIKE -> out.add(expr + " NOT ILIKE ?", new BindParam.Text(filter.value().asScalar()));
            case IN -> {
                List<String> values = filter.value().asList();
                if (values.isEmpty()) {
                    out.add("1=0");
                } else {
                    out.add(expr + " = ANY(?)", new BindParam.TextArray(values));
                }
            }
            case NOT_IN -> {
                List<String> values = filter.value().asList();
                if (!values.isEmpty()) {
                    out.add(expr + " <> ALL(?)", new BindParam.TextArray(values));
                }
            }
            default -> throw new IllegalStateException("unexpected text operator " + filter.op());
        }
    }

    private static void applyInteger(Filter filter, String expr, SqlClauses out) {
        FilterOp op = filter.op();
        if (op.isList()) {
            List<Long> values = new ArrayList<>();
            for (String raw : filter.value().asList()) {
                values.add(parseInteger(filter.field(), raw));
            }
            if (values.isEmpty()) {
                if (op == IN) out.add("1=0");
                return;
            }
            String clause = op == IN ? expr + " = ANY(?)" : expr + " <> ALL(?)";
            out.add(clause, new BindParam.IntArray(values));
            return;
        }
        long value = parseInteger(filter.field(), filter.value().asScalar());
        out.add(expr + " " + comparison(op) + " ?", new BindParam.Int(value));
    }

    private static void applyArray(Filter filter, String expr, String operator, SqlClauses out) {
        List<String> values = filter.value().asValues();
        if (values.isEmpty()) {
            return;
        }
        String clause = "coalesce(" + expr + ", ARRAY[]::text[]) " + operator + " ?";
        if (filter.op().isNegated()) {
            clause = "NOT (" + clause + ")";
        }
        out.add(clause, new BindParam.TextArray(values));
    }

    static String comparison(FilterOp op) {
        return switch (op) {
            case EQ -> "=";
            case NOT_EQ -> "<>";
            case GT -> ">";
            case GTE -> ">=";
            case LT -> "<";
            case LTE -> "<=";
            default -> throw new IllegalStateException("not a comparison: " + op);
        };
    }

    public static long parseInteger(String field, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(field + " must be an integer");
        }
    }

    public static double parseFloat(String field, String raw) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidRequestException(field + " must be numeric");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(field + " must be numeric");
        }
    }

    public static boolean parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new InvalidRequestException("invalid boolean value '" + raw + "'");
        };
    }

    private InvalidRequestException unsupportedOperator(String field, FilterOp op) {
        if (op.isList()) {
            return new InvalidRequestException(field + " filter does not support lists");
        }
        if (EQUALITY.containsAll(ops) || MEMBERSHIP.containsAll(ops)) {
            return new InvalidRequestException(field + " filter only supports equality");
        }
        return new InvalidRequestException(
                field + " filter does not support operator " + op.name().toLowerCase(Locale.ROOT));
    }
}
