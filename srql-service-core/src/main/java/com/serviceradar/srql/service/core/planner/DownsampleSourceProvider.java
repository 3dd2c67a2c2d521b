package com.serviceradar.srql.service.core.planner;

import com.serviceradar.srql.service.core.parser.Entity;

/** Implemented by planners of metric entities that support {@code bucket:}. */
public interface DownsampleSourceProvider {

    DownsampleSource downsampleSource(Entity entity);
}
