package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Queryable domains addressed by {@code in:<entity>}. Names are matched case-insensitively. */
public enum Entity {
    AGENTS("agents", "agent", "ocsf_agents"),
    DEVICES("devices", "device", "device_inventory"),
    DEVICE_UPDATES("device_updates", "device_update"),
    DEVICE_GRAPH("device_graph"),
    GRAPH_CYPHER("graph_cypher", "cypher"),
    EVENTS("events", "activity"),
    LOGS("logs"),
    SERVICES("services", "service", "service_status"),
    GATEWAYS("gateways", "gateway", "pollers", "poller"),
    INTERFACES("interfaces", "discovered_interfaces"),
    OTEL_METRICS("otel_metrics"),
    RPERF_METRICS("rperf_metrics", "rperf"),
    CPU_METRICS("cpu_metrics", "cpu"),
    MEMORY_METRICS("memory_metrics", "memory"),
    DISK_METRICS("disk_metrics", "disk"),
    PROCESS_METRICS("process_metrics", "processes"),
    TIMESERIES_METRICS("timeseries_metrics", "metrics"),
    SNMP_METRICS("snmp_metrics", "snmp"),
    TRACE_SUMMARIES("trace_summaries", "otel_trace_summaries"),
    TRACES("traces", "otel_traces"),
    FLOWS("flows", "netflow", "network_activity");

    private static final Map<String, Entity> BY_NAME = new HashMap<>();

    static {
        for (Entity entity : values()) {
            for (String alias : entity.aliases) {
                BY_NAME.put(alias, entity);
            }
        }
    }

    private final List<String> aliases;

    Entity(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /** Canonical query-language name, e.g. {@code cpu_metrics}. */
    public String label() {
        return aliases.get(0);
    }

    public static Entity resolve(String raw) {
        String key = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        Entity entity = BY_NAME.get(key);
        if (entity == null) {
            throw new InvalidRequestException("unsupported entity '" + raw + "'");
        }
        return entity;
    }
}
