package com.serviceradar.srql.service.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.serviceradar.srql.service.core.PlanFixtures;
import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.OrderClause;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class QueryPlanAssemblerTest {

    @Test
    void defaultLimitAppliesWhenNothingIsRequested() {
        assertEquals(100, PlanFixtures.plan("in:devices").limit());
    }

    @Test
    void requestLimitOverridesQueryLimit() {
        QueryPlan plan = PlanFixtures.plan(new QueryRequest("in:devices limit:5", 20L, null));

        assertEquals(20, plan.limit());
        assertEquals(5, PlanFixtures.plan("in:devices limit:5").limit());
    }

    @Test
    void limitIsClampedToConfiguredMaximum() {
        assertEquals(500, PlanFixtures.plan("in:logs limit:100000").limit());
        assertEquals(1, PlanFixtures.plan(new QueryRequest("in:logs", -3L, null)).limit());
    }

    @Test
    void cursorBecomesOffset() {
        QueryPlan plan = PlanFixtures.plan(new QueryRequest("in:logs", 50L, CursorCodec.encode(150)));

        assertEquals(150, plan.offset());
    }

    @Test
    void relativeWindowBeforeTheEarliestInstantIsAnInvalidRequest() {
        assertThrows(InvalidRequestException.class, () -> PlanFixtures.compile("in:logs time:last_1000000000000d"));
    }

    @Test
    void garbageCursorIsRejected() {
        assertThrows(InvalidRequestException.class,
                () -> PlanFixtures.plan(new QueryRequest("in:logs", null, "%%%")));
    }

    @Test
    void relativeTimeIsResolvedAgainstClock() {
        QueryPlan plan = PlanFixtures.plan("in:events time:last_1h");

        assertEquals(Instant.parse("2025-06-01T11:00:00Z"), plan.timeRange().start());
        assertEquals(PlanFixtures.NOW, plan.timeRange().end());
        assertNull(PlanFixtures.plan("in:events").timeRange());
    }

    @Test
    void devicesTranslateDeviceIdToUid() {
        QueryPlan plan = PlanFixtures.plan("in:devices device_id:abc sort:device_id:asc");

        assertThat(plan.filters()).extracting(Filter::field).containsExactly("uid");
        assertThat(plan.order()).extracting(OrderClause::field).containsExactly("uid");
    }

    @Test
    void otherEntitiesTranslateUidToDeviceId() {
        QueryPlan plan = PlanFixtures.plan("in:cpu_metrics uid:abc time:last_1h bucket:1m series:uid");

        assertThat(plan.filters()).extracting(Filter::field).containsExactly("device_id");
        assertEquals("device_id", plan.downsample().series());
    }

    @Test
    void agentsKeepFieldNamesAsWritten() {
        assertEquals("uid", QueryPlanAssembler.normalizeDeviceField(Entity.AGENTS, "uid"));
        assertEquals("device_id", QueryPlanAssembler.normalizeDeviceField(Entity.AGENTS, "device_id"));
    }
}
