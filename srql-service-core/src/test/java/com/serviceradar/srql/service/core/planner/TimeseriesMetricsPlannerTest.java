package com.serviceradar.srql.service.core.planner;

import static org.assertj.core.api.Assertions.assertThat;

import com.serviceradar.srql.service.core.PlanFixtures;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import org.junit.jupiter.api.Test;

class TimeseriesMetricsPlannerTest {

    @Test
    void snmpPinsMetricTypeBetweenTimeRangeAndFilters() {
        CompiledQuery query = PlanFixtures.compile("in:snmp_metrics time:last_1h metric_name:ifInOctets");

        assertThat(query.sql()).contains("FROM \"timeseries_metrics\"")
                .contains("\"timeseries_metrics\".\"metric_type\" = ?");
        assertThat(query.binds()).containsExactly(
                new BindParam.Timestamptz("2025-06-01T11:00:00Z"),
                new BindParam.Timestamptz("2025-06-01T12:00:00Z"),
                new BindParam.Text("snmp"),
                new BindParam.Text("ifInOctets"),
                new BindParam.Int(100),
                new BindParam.Int(0));
    }

    @Test
    void userMetricTypeFilterCannotReplaceThePinnedType() {
        CompiledQuery query = PlanFixtures.compile("in:rperf_metrics metric_type:snmp");

        assertThat(query.binds()).startsWith(new BindParam.Text("rperf"), new BindParam.Text("snmp"));
    }

    @Test
    void genericTimeseriesHasNoPinnedType() {
        CompiledQuery query = PlanFixtures.compile("in:timeseries_metrics");

        assertThat(query.sql()).doesNotContain("metric_type");
        assertThat(query.binds()).hasSize(2);
    }
}
