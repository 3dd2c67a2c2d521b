package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.Entity;
import com.serviceradar.srql.service.core.plan.QueryPlan;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Routes a plan to its entity planner, or to the downsample planner when {@code bucket:} is set. */
@Component
public class PlannerRegistry {

    private final Map<Entity, EntityPlanner> planners = new EnumMap<>(Entity.class);
    private final DownsamplePlanner downsamplePlanner = new DownsamplePlanner();

    public PlannerRegistry() {
        this(defaultPlanners());
    }

    public PlannerRegistry(List<EntityPlanner> entityPlanners) {
        for (EntityPlanner planner : entityPlanners) {
            for (Entity entity : planner.entities()) {
                if (planners.putIfAbsent(entity, planner) != null) {
                    throw new IllegalStateException("duplicate planner for entity " + entity);
                }
            }
        }
    }

    public static List<EntityPlanner> defaultPlanners() {
        return List.of(
                new AgentsPlanner(),
                new DevicesPlanner(),
                new DeviceUpdatesPlanner(),
                new DeviceGraphPlanner(),
                new GraphCypherPlanner(),
                new EventsPlanner(),
                new LogsPlanner(),
                new ServicesPlanner(),
                new GatewaysPlanner(),
                new InterfacesPlanner(),
                new OtelMetricsPlanner(),
                new TimeseriesMetricsPlanner(),
                new CpuMetricsPlanner(),
                new MemoryMetricsPlanner(),
                new DiskMetricsPlanner(),
                new ProcessMetricsPlanner(),
                new TraceSummariesPlanner(),
                new TracesPlanner(),
                new FlowsPlanner());
    }

    public EntityPlanner plannerFor(Entity entity) {
        EntityPlanner planner = planners.get(entity);
        if (planner == null) {
            throw new InvalidRequestException("unsupported entity '" + entity.label() + "'");
        }
        return planner;
    }

    public CompiledQuery compile(QueryPlan plan) {
        EntityPlanner planner = plannerFor(plan.entity());
        if (plan.downsample() != null) {
            if (!(planner instanceof DownsampleSourceProvider provider)) {
                throw new InvalidRequestException("downsample is only supported for metric entities");
            }
            return downsamplePlanner.compile(plan, provider.downsampleSource(plan.entity()));
        }
        return planner.compile(plan);
    }
}
