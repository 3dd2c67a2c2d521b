package com.serviceradar.srql.service.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw stats expression plus a best-effort parse of its simple terms. Entity planners validate the
 * raw expression against their own grammar; the parsed terms are informational.
 */
public record StatsSpec(String expression, List<StatsAggregation> aggregations) {

    private static final Pattern TERM = Pattern.compile(
            "^(?<fn>[a-z_]+)\\s*\\(\\s*(?<field>[^()]*?)\\s*\\)(?:\\s+as\\s+(?<alias>\\S+))?(?:\\s+by\\s+\\S+)?$",
            Pattern.CASE_INSENSITIVE);

    public StatsSpec {
        aggregations = List.copyOf(aggregations);
    }

    public static StatsSpec parse(String expression) {
        List<StatsAggregation> aggregations = new ArrayList<>();
        for (String term : SrqlTokenizer.splitTopLevel(expression, ',')) {
            Matcher m = TERM.matcher(term);
            if (!m.matches()) {
                continue;
            }
            StatsAggregation.Type type = switch (m.group("fn").toLowerCase(Locale.ROOT)) {
                case "count" -> StatsAggregation.Type.COUNT;
                case "sum" -> StatsAggregation.Type.SUM;
                case "avg" -> StatsAggregation.Type.AVG;
                case "min" -> StatsAggregation.Type.MIN;
                case "max" -> StatsAggregation.Type.MAX;
                default -> null;
            };
            if (type == null) {
                continue;
            }
            String field = m.group("field");
            if (field.isEmpty() || field.equals("*")) {
                field = null;
            } else {
                field = field.toLowerCase(Locale.ROOT);
            }
            String alias = m.group("alias");
            if (alias == null) {
                String fn = type.name().toLowerCase(Locale.ROOT);
                alias = field == null ? fn : fn + "_" + field;
            }
            aggregations.add(new StatsAggregation(type, field, alias));
        }
        return new StatsSpec(expression, aggregations);
    }
}
