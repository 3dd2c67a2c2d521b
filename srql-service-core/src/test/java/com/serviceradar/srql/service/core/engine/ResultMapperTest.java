package com.serviceradar.srql.service.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serviceradar.srql.service.core.error.InternalQueryException;
import com.serviceradar.srql.service.core.sql.ResultShape;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

class ResultMapperTest {

    private final ResultMapper mapper = new ResultMapper(new ObjectMapper());

    private static PGobject jsonb(String json) throws Exception {
        PGobject pg = new PGobject();
        pg.setType("jsonb");
        pg.setValue(json);
        return pg;
    }

    @Test
    void rowsBecomeObjectsWithIsoTimestamps() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uid", "dev-1");
        row.put("last_seen_time", Timestamp.from(Instant.parse("2025-06-01T10:15:00Z")));
        row.put("is_available", true);
        row.put("hostname", null);

        List<JsonNode> results = mapper.map(List.of(row), ResultShape.ROWS);

        JsonNode node = results.get(0);
        assertEquals("dev-1", node.get("uid").asText());
        assertEquals("2025-06-01T10:15:00Z", node.get("last_seen_time").asText());
        assertThat(node.get("is_available").booleanValue()).isTrue();
        assertThat(node.get("hostname").isNull()).isTrue();
    }

    @Test
    void jsonbColumnsAreInlined() throws Exception {
        Map<String, Object> row = Map.of("metadata", jsonb("{\"rack\":\"r1\"}"));

        JsonNode node = mapper.map(List.of(row), ResultShape.ROWS).get(0);

        assertEquals("r1", node.get("metadata").get("rack").asText());
    }

    @Test
    void payloadRowsUnwrapAndSkipNulls() throws Exception {
        Map<String, Object> nullPayload = new LinkedHashMap<>();
        nullPayload.put("payload", null);

        List<JsonNode> results = mapper.map(
                List.of(Map.of("payload", jsonb("{\"total\":3}")), nullPayload), ResultShape.PAYLOAD);

        assertThat(results).hasSize(1);
        assertEquals(3, results.get(0).get("total").asInt());
    }

    @Test
    void singlePayloadWithoutRowsIsEmptyObject() {
        List<JsonNode> results = mapper.map(Collections.emptyList(), ResultShape.SINGLE_PAYLOAD);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).isObject()).isTrue();
        assertThat(results.get(0).size()).isZero();
    }

    @Test
    void malformedJsonIsAnInternalError() throws Exception {
        PGobject broken = jsonb("{not json");

        assertThatThrownBy(() -> mapper.map(List.of(Map.of("payload", broken)), ResultShape.PAYLOAD))
                .isInstanceOf(InternalQueryException.class);
    }
}
