package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.parser.Filter;
import com.serviceradar.srql.service.core.parser.FilterOp;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.ResultShape;
import java.util.List;
import java.util.Set;

/**
 * Neighborhood of one device in the topology graph, computed by the
 * {@code public.age_device_neighborhood(device_id, collector_owned_only, include_topology)} function.
 */
public class DeviceGraphPlanner implements EntityPlanner {

    static final String SQL = "SELECT public.age_device_neighborhood(?, ?, ?) AS payload";

    @Override
    public Set<Entity> entities() {
        return Set.of(Entity.DEVICE_GRAPH);
    }

    @Override
    public CompiledQuery compile(QueryPlan plan) {
        if (plan.entity() != Entity.DEVICE_GRAPH) {
            throw new InvalidRequestException("entity '" + plan.entity().label() + "' is not handled by the device_graph planner");
        }
        if (plan.stats() != null || plan.rollupStats() != null) {
            throw new InvalidRequestException("stats are not supported for device_graph");
        }

        String deviceId = null;
        boolean collectorOwnedOnly = false;
        boolean includeTopology = true;
        for (Filter filter : plan.filters()) {
            switch (filter.field()) {
                case "device_id" -> deviceId = equalityValue(filter);
                case "collector_owned_only" -> collectorOwnedOnly = ColumnHandler.parseBoolean(equalityValue(filter));
                case "include_topology" -> includeTopology = ColumnHandler.parseBoolean(equalityValue(filter));
                default -> throw new InvalidRequestException(
                        "unsupported filter field for device_graph: '" + filter.field() + "'");
            }
        }
        if (deviceId == null || deviceId.isBlank()) {
            throw new InvalidRequestException("device_graph queries require device_id");
        }

        return new CompiledQuery(
                SQL,
                List.of(new BindParam.Text(deviceId), new BindParam.Bool(collectorOwnedOnly), new BindParam.Bool(includeTopology)),
                ResultShape.PAYLOAD);
    }

    private static String equalityValue(Filter filter) {
        if (filter.op() != FilterOp.EQ) {
            throw new InvalidRequestException(filter.field() + " filter only supports equality");
        }
        return filter.value().asScalar();
    }
}
