package com.serviceradar.srql.service.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.time.TimeFilterSpec;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SrqlParserTest {

    private final SrqlParser parser = new SrqlParser();

    @Test
    void parsesDeviceListFilterLimitAndSort() {
        QueryAst ast = parser.parse("in:devices discovery_sources:(sweep,armis) limit:2 sort:last_seen:desc");

        assertEquals(Entity.DEVICES, ast.entity());
        assertThat(ast.filters()).containsExactly(
                new Filter("discovery_sources", FilterOp.IN, new FilterValue.ListValue(List.of("sweep", "armis"))));
        assertEquals(2L, ast.limit());
        assertThat(ast.order()).containsExactly(new OrderClause("last_seen", OrderDirection.DESC));
    }

    @Test
    void parsesQuotedStatsWithTimeFilter() {
        QueryAst ast = parser.parse("in:logs stats:\"count() as total\" time:last_24h");

        assertThat(ast.stats().aggregations())
                .containsExactly(new StatsAggregation(StatsAggregation.Type.COUNT, null, "total"));
        assertEquals(new TimeFilterSpec.Relative(Duration.ofHours(24)), ast.timeFilter());
    }

    @Test
    void statsAliasMayFollowAsSeparateTokens() {
        QueryAst ast = parser.parse("in:devices stats:count() as total");

        assertEquals("count() as total", ast.stats().expression());
        assertEquals("total", ast.stats().aggregations().get(0).alias());
    }

    @Test
    void statsWithDanglingAsIsRejected() {
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:devices stats:count() as"));
    }

    @Test
    void statsAliasThatLooksLikeATokenIsRejected() {
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:devices stats:count() as limit:5"));
    }

    @Test
    void statsExpressionIsCappedAt1024Characters() {
        String tooLong = "count()" + " ".repeat(SrqlParser.MAX_STATS_EXPRESSION_LENGTH);

        assertThatThrownBy(() -> parser.parse("in:logs stats:\"" + tooLong + "x\""))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("1024");
    }

    @Test
    void rangePrefixBecomesOperatorAndIsStripped() {
        QueryAst ast = parser.parse("in:cpu_metrics usage_percent:>90 time:last_1h");

        assertEquals(Entity.CPU_METRICS, ast.entity());
        assertThat(ast.filters()).containsExactly(
                new Filter("usage_percent", FilterOp.GT, new FilterValue.Scalar("90")));
    }

    @Test
    void allRangePrefixesAreRecognised() {
        QueryAst ast = parser.parse("in:cpu usage_percent:>=1 usage_percent:<=2 usage_percent:<3");

        assertThat(ast.filters()).extracting(Filter::op).containsExactly(FilterOp.GTE, FilterOp.LTE, FilterOp.LT);
        assertThat(ast.filters()).extracting(f -> f.value().asScalar()).containsExactly("1", "2", "3");
    }

    @Test
    void negationTogglesOperatorWithoutTouchingFieldOrValue() {
        for (String[] pair : new String[][] {
            {"hostname:core", "!hostname:core"},
            {"hostname:%core%", "!hostname:%core%"},
            {"ip:(a,b)", "!ip:(a,b)"}
        }) {
            Filter plain = parser.parse("in:devices " + pair[0]).filters().get(0);
            Filter negated = parser.parse("in:devices " + pair[1]).filters().get(0);

            assertEquals(plain.field(), negated.field());
            assertEquals(plain.value(), negated.value());
            assertEquals(plain.op().negate(), negated.op());
        }
    }

    @Test
    void percentSelectsLike() {
        Filter filter = parser.parse("in:devices hostname:%edge%").filters().get(0);

        assertEquals(FilterOp.LIKE, filter.op());
        assertEquals("%edge%", filter.value().asScalar());
    }

    @Test
    void fieldAndKeysAreLowerCased() {
        QueryAst ast = parser.parse("IN:Devices HostName:Core SORT:Hostname:ASC");

        assertEquals("hostname", ast.filters().get(0).field());
        assertEquals("Core", ast.filters().get(0).value().asScalar());
        assertThat(ast.order()).containsExactly(new OrderClause("hostname", OrderDirection.ASC));
    }

    @Test
    void listWithMaxValuesIsAcceptedAndOneMoreIsRejected() {
        String atCap = values(SrqlParser.MAX_FILTER_LIST_VALUES);
        String overCap = values(SrqlParser.MAX_FILTER_LIST_VALUES + 1);

        assertEquals(200, parser.parse("in:devices ip:(" + atCap + ")").filters().get(0).value().asList().size());
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:devices ip:(" + overCap + ")"));
    }

    @Test
    void sortDefaultsToDescendingAndSplitsOnCommas() {
        QueryAst ast = parser.parse("in:logs sort:timestamp,severity_number:asc,service_name:sideways");

        assertThat(ast.order()).containsExactly(
                new OrderClause("timestamp", OrderDirection.DESC),
                new OrderClause("severity_number", OrderDirection.ASC),
                new OrderClause("service_name", OrderDirection.DESC));
    }

    @Test
    void downsampleClausesCombineIntoSpec() {
        QueryAst ast = parser.parse("in:cpu_metrics time:last_1h bucket:5m agg:mean series:\"device_id\"");

        assertEquals(new DownsampleSpec(300, DownsampleAgg.AVG, "device_id"), ast.downsample());
    }

    @Test
    void aggWithoutBucketIsRejected() {
        assertThatThrownBy(() -> parser.parse("in:cpu_metrics agg:max"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("downsample requires bucket:<duration>");
    }

    @Test
    void bucketOutsideAllowedRangeIsRejected() {
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:cpu bucket:0m"));
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:cpu bucket:32d"));
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:cpu bucket:5y"));
        assertEquals(31L * 86400, parser.parse("in:cpu bucket:31d").downsample().bucketSeconds());
    }

    @Test
    void bucketThatOverflowsADurationIsRejectedAsTooLarge() {
        assertThatThrownBy(() -> parser.parse("in:cpu_metrics time:last_1h bucket:999999999999999d"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("bucket duration must not exceed 31 days");
        assertThatThrownBy(() -> parser.parse("in:cpu_metrics bucket:9223372036854775807m"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("bucket duration must not exceed 31 days");
    }

    @Test
    void timeWindowThatOverflowsADurationIsRejected() {
        assertThatThrownBy(() -> parser.parse("in:logs time:last_9000000000000000w"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("time window is too large");
    }

    @Test
    void reservedPlaceholderKeysAreIgnored() {
        QueryAst ast = parser.parse("in:logs window:5m bounded:true mode:live");

        assertThat(ast.filters()).isEmpty();
    }

    @Test
    void rollupStatsIsLowerCased() {
        assertEquals("severity", parser.parse("in:logs rollup_stats:Severity").rollupStats());
    }

    @Test
    void missingEntityIsRejected() {
        assertThatThrownBy(() -> parser.parse("hostname:core"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("queries must include an in:<entity> token");
    }

    @Test
    void tokenWithoutColonIsRejected() {
        assertThatThrownBy(() -> parser.parse("in:devices core"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("missing ':' in token");
    }

    @Test
    void unknownEntityIsRejected() {
        assertThatThrownBy(() -> parser.parse("in:widgets"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("unsupported entity 'widgets'");
    }

    @Test
    void limitMustBePositiveInteger() {
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:devices limit:0"));
        assertThrows(InvalidRequestException.class, () -> parser.parse("in:devices limit:ten"));
    }

    @Test
    void entityAliasesResolveCaseInsensitively() {
        assertEquals(Entity.CPU_METRICS, Entity.resolve("CPU"));
        assertEquals(Entity.GATEWAYS, Entity.resolve("pollers"));
        assertEquals(Entity.SNMP_METRICS, Entity.resolve("snmp_metrics"));
    }

    @Test
    void scalarAccessorOnListFails() {
        FilterValue list = new FilterValue.ListValue(List.of("a"));

        assertThatThrownBy(list::asScalar).hasMessage("expected scalar value");
        assertThatThrownBy(() -> new FilterValue.Scalar("a").asList()).hasMessage("expected list value");
    }

    @Test
    void noStatsMeansNullStats() {
        assertNull(parser.parse("in:devices").stats());
    }

    private static String values(int count) {
        return IntStream.range(0, count).mapToObj(i -> "v" + i).collect(Collectors.joining(","));
    }
}
