package com.serviceradar.srql.service.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.serviceradar.srql.service.core.error.InternalQueryException;
import com.serviceradar.srql.service.core.sql.ResultShape;
import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.postgresql.util.PGobject;
import org.springframework.stereotype.Component;

/** Turns JDBC rows into JSON results. Timestamps become ISO-8601 UTC strings; json/jsonb columns are inlined. */
@Component
@RequiredArgsConstructor
public class ResultMapper {

    static final String PAYLOAD_COLUMN = "payload";

    private final ObjectMapper objectMapper;

    public List<JsonNode> map(List<Map<String, Object>> rows, ResultShape shape) {
        List<JsonNode> results = new ArrayList<>(rows.size());
        switch (shape) {
            case ROWS -> rows.forEach(row -> results.add(toObject(row)));
            case PAYLOAD -> rows.forEach(row -> {
                JsonNode payload = toJson(row.get(PAYLOAD_COLUMN));
                if (!payload.isNull()) {
                    results.add(payload);
                }
            });
            case SINGLE_PAYLOAD -> {
                JsonNode payload = rows.isEmpty() ? NullNode.getInstance() : toJson(rows.get(0).get(PAYLOAD_COLUMN));
                results.add(payload.isNull() ? objectMapper.createObjectNode() : payload);
            }
        }
        return results;
    }

    private ObjectNode toObject(Map<String, Object> row) {
        ObjectNode node = objectMapper.createObjectNode();
        row.forEach((column, value) -> node.set(column, toJson(value)));
        return node;
    }

    JsonNode toJson(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof PGobject pg) {
            if (pg.getValue() == null) {
                return NullNode.getInstance();
            }
            if ("json".equals(pg.getType()) || "jsonb".equals(pg.getType())) {
                try {
                    return objectMapper.readTree(pg.getValue());
                } catch (JsonProcessingException e) {
                    throw new InternalQueryException("failed to decode " + pg.getType() + " column", e);
                }
            }
            return TextNode.valueOf(pg.getValue());
        }
        if (value instanceof Timestamp ts) {
            return TextNode.valueOf(ts.toInstant().toString());
        }
        if (value instanceof OffsetDateTime odt) {
            return TextNode.valueOf(odt.toInstant().toString());
        }
        if (value instanceof UUID uuid) {
            return TextNode.valueOf(uuid.toString());
        }
        if (value instanceof Array array) {
            try {
                ArrayNode node = objectMapper.createArrayNode();
                for (Object element : (Object[]) array.getArray()) {
                    node.add(toJson(element));
                }
                return node;
            } catch (SQLException e) {
                throw new InternalQueryException("failed to read array column", e);
            }
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new InternalQueryException("failed to serialize column of type " + value.getClass().getName(), e);
        }
    }
}
