package com.serviceradar.srql.service.core.sql;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;
import java.util.List;

/**
 * Typed value for one positional placeholder. Serialized as {@code {"t":"text","v":"..."}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "t")
@JsonSubTypes({
    @JsonSubTypes.Type(value = BindParam.Text.class, name = "text"),
    @JsonSubTypes.Type(value = BindParam.TextArray.class, name = "text_array"),
    @JsonSubTypes.Type(value = BindParam.IntArray.class, name = "int_array"),
    @JsonSubTypes.Type(value = BindParam.Bool.class, name = "bool"),
    @JsonSubTypes.Type(value = BindParam.Int.class, name = "int"),
    @JsonSubTypes.Type(value = BindParam.Float.class, name = "float"),
    @JsonSubTypes.Type(value = BindParam.Timestamptz.class, name = "timestamptz")
})
public sealed interface BindParam {

    /** PostgreSQL type the placeholder is declared with. */
    String sqlType();

    record Text(@JsonProperty("v") String value) implements BindParam {
        @Override
        public String sqlType() {
            return "text";
        }
    }

    record TextArray(@JsonProperty("v") List<String> value) implements BindParam {
        public TextArray {
            value = List.copyOf(value);
        }

        @Override
        public String sqlType() {
            return "text[]";
        }
    }

    record IntArray(@JsonProperty("v") List<Long> value) implements BindParam {
        public IntArray {
            value = List.copyOf(value);
        }

        @Override
        public String sqlType() {
            return "int8[]";
        }
    }

    record Bool(@JsonProperty("v") boolean value) implements BindParam {
        @Override
        public String sqlType() {
            return "bool";
        }
    }

    record Int(@JsonProperty("v") long value) implements BindParam {
        @Override
        public String sqlType() {
            return "int8";
        }
    }

    record Float(@JsonProperty("v") double value) implements BindParam {
        @Override
        public String sqlType() {
            return "float8";
        }
    }

    /** RFC 3339 instant in UTC. */
    record Timestamptz(@JsonProperty("v") String value) implements BindParam {
        public static Timestamptz of(Instant instant) {
            return new Timestamptz(instant.toString());
        }

        @Override
        public String sqlType() {
            return "timestamptz";
        }
    }
}
