package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.time.TimeFilterSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SRQL parser: {@code in:<entity>} followed by {@code key:value} tokens.
 *
 * Reserved keys:
 *  - in, limit, sort|order, time|timeframe
 *  - bucket|downsample, agg, series
 *  - stats (optionally followed by a separate {@code as <alias>} pair), rollup_stats
 *  - window, bounded, mode (accepted and ignored)
 *
 * Any other key is a filter.
 */
public final class SrqlParser {

    public static final int MAX_FILTER_LIST_VALUES = 200;
    public static final int MAX_STATS_EXPRESSION_LENGTH = 1024;

    public QueryAst parse(String query) {
        List<String> tokens = SrqlTokenizer.tokenize(query);

        Entity entity = null;
        List<Filter> filters = new ArrayList<>();
        List<OrderClause> order = new ArrayList<>();
        Long limit = null;
        TimeFilterSpec timeFilter = null;
        StatsSpec stats = null;
        Long bucketSeconds = null;
        DownsampleAgg agg = null;
        String series = null;
        String rollupStats = null;

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            int colon = token.indexOf(':');
            if (colon < 0) {
                throw new InvalidRequestException("missing ':' in token '" + token + "'");
            }
            String key = token.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            FilterValue value = SrqlTokenizer.parseValue(token.substring(colon + 1));

            switch (key) {
                case "in" -> {
                    if (entity != null) {
                        throw new InvalidRequestException("only one in:<entity> token is allowed");
                    }
                    entity = Entity.resolve(value.asScalar());
                }
                case "limit" -> limit = parseLimit(value.asScalar());
                case "sort", "order" -> order.addAll(parseOrder(value.asScalar()));
                case "time", "timeframe" -> timeFilter = TimeFilterSpec.parse(value.asScalar());
                case "bucket", "downsample" -> bucketSeconds = BucketDurationParser.parse(value.asScalar()).getSeconds();
                case "agg" -> agg = DownsampleAgg.parse(value.asScalar());
                case "series" -> {
                    String normalized = SrqlTokenizer.stripQuotes(value.asScalar()).trim();
                    series = normalized.isEmpty() ? null : normalized.toLowerCase(Locale.ROOT);
                }
                case "stats" -> {
                    String expression = value.asScalar().trim();
                    if (i + 1 < tokens.size() && tokens.get(i + 1).equalsIgnoreCase("as")) {
                        if (i + 2 >= tokens.size() || tokens.get(i + 2).contains(":")) {
                            throw new InvalidRequestException("stats alias missing after 'as'");
                        }
                        expression = expression + " as " + tokens.get(i + 2);
                        i += 2;
                    }
                    stats = parseStats(expression);
                }
                case "rollup_stats" -> {
                    String type = value.asScalar().trim().toLowerCase(Locale.ROOT);
                    if (type.isEmpty()) {
                        throw new InvalidRequestException("rollup_stats requires a stat type");
                    }
                    rollupStats = type;
                }
                case "window", "bounded", "mode" -> {
                    // reserved, no effect yet
                }
                default -> filters.add(buildFilter(key, value));
            }
        }

        if (entity == null) {
            throw new InvalidRequestException("queries must include an in:<entity> token");
        }

        DownsampleSpec downsample = null;
        if (bucketSeconds != null) {
            downsample = new DownsampleSpec(bucketSeconds, agg == null ? DownsampleAgg.AVG : agg, series);
        } else if (agg != null || series != null) {
            throw new InvalidRequestException("downsample requires bucket:<duration>");
        }

        return new QueryAst(entity, filters, order, limit, timeFilter, stats, downsample, rollupStats);
    }

    private static long parseLimit(String raw) {
        long limit;
        try {
            limit = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("invalid limit '" + raw + "'");
        }
        if (limit <= 0) {
            throw new InvalidRequestException("limit must be a positive integer");
        }
        return limit;
    }

    private static List<OrderClause> parseOrder(String raw) {
        List<OrderClause> clauses = new ArrayList<>();
        for (String segment : raw.split(",")) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            String field = colon < 0 ? trimmed : trimmed.substring(0, colon);
            String direction = colon < 0 ? null : trimmed.substring(colon + 1);
            if (field.isBlank()) {
                continue;
            }
            clauses.add(new OrderClause(field.trim().toLowerCase(Locale.ROOT), OrderDirection.parse(direction)));
        }
        return clauses;
    }

    private static StatsSpec parseStats(String expression) {
        if (expression.isEmpty()) {
            throw new InvalidRequestException("stats expression cannot be empty");
        }
        if (expression.length() > MAX_STATS_EXPRESSION_LENGTH) {
            throw new InvalidRequestException(
                    "stats expression exceeds " + MAX_STATS_EXPRESSION_LENGTH + " characters");
        }
        return StatsSpec.parse(expression);
    }

    private static Filter buildFilter(String key, FilterValue value) {
        if (value instanceof FilterValue.ListValue list && list.values().size() > MAX_FILTER_LIST_VALUES) {
            throw new InvalidRequestException(
                    "filter '" + key + "' exceeds " + MAX_FILTER_LIST_VALUES + " list values");
        }
        Filter filter = Filter.of(key, value);
        if (filter.field().isEmpty()) {
            throw new InvalidRequestException("filter field cannot be empty");
        }
        return filter;
    }
}
