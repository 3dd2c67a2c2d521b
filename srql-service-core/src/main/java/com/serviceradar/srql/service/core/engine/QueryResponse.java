package com.serviceradar.srql.service.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.serviceradar.srql.service.core.plan.PaginationMeta;
import java.util.List;

public record QueryResponse(List<JsonNode> results, PaginationMeta pagination) {}
