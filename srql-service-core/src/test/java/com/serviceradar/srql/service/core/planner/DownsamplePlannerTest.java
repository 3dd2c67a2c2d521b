package com.serviceradar.srql.service.core.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.serviceradar.srql.service.core.PlanFixtures;
import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import org.junit.jupiter.api.Test;

class DownsamplePlannerTest {

    @Test
    void cpuSeriesBucketsUsageByDevice() {
        CompiledQuery query = PlanFixtures.compile(
                "in:cpu_metrics time:last_1h bucket:5m agg:max series:device_id host_id:h1");

        assertEquals("SELECT time_bucket(make_interval(secs => 300), timestamp) AS timestamp, "
                + "coalesce(device_id, '') AS series, max(usage_percent) AS value"
                + "\nFROM cpu_metrics"
                + "\nWHERE timestamp >= ? AND timestamp <= ? AND host_id = ?"
                + "\nGROUP BY 1, 2"
                + "\nORDER BY 1 ASC"
                + "\nLIMIT ? OFFSET ?", query.sql());
        assertEquals(5, query.binds().size());
        assertEquals(ResultShape.ROWS, query.shape());
    }

    @Test
    void withoutSeriesTheSeriesColumnIsNull() {
        CompiledQuery query = PlanFixtures.compile("in:memory_metrics time:last_1h bucket:1m");

        assertThat(query.sql()).contains("NULL::text AS series").contains("avg(");
    }

    @Test
    void countIsCastToDouble() {
        assertThat(PlanFixtures.compile("in:cpu time:last_1h bucket:1h agg:count").sql())
                .contains("COUNT(*)::double precision AS value");
    }

    @Test
    void snmpDownsampleKeepsPinnedMetricType() {
        CompiledQuery query = PlanFixtures.compile("in:snmp time:last_1h bucket:1m series:if_index");

        assertThat(query.sql()).contains("coalesce(if_index::text, '') AS series")
                .contains("AND metric_type = ?");
        assertThat(query.binds().get(2)).isEqualTo(new BindParam.Text("snmp"));
    }

    @Test
    void timeRangeIsRequired() {
        assertThatThrownBy(() -> PlanFixtures.compile("in:cpu_metrics bucket:5m"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("downsample queries require time:<range>");
    }

    @Test
    void statsCannotBeCombinedWithDownsample() {
        assertThatThrownBy(() -> PlanFixtures.compile("in:cpu_metrics time:last_1h bucket:5m stats:count()"))
                .hasMessage("downsample cannot be combined with stats");
    }

    @Test
    void unknownSeriesIsRejected() {
        assertThatThrownBy(() -> PlanFixtures.compile("in:cpu_metrics time:last_1h bucket:5m series:colour"))
                .hasMessage("unsupported series field 'colour' for cpu_metrics");
    }

    @Test
    void filtersOutsideTheTableAreRejected() {
        assertThatThrownBy(() -> PlanFixtures.compile("in:cpu_metrics time:last_1h bucket:5m mount_point:/"))
                .hasMessage("unsupported filter field for downsample cpu_metrics: 'mount_point'");
    }
}
