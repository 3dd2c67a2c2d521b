package com.serviceradar.srql.service.core.time;

import java.time.Instant;

/** Inclusive {@code [start, end]} window applied to an entity's timestamp column. */
public record TimeRange(Instant start, Instant end) {}
