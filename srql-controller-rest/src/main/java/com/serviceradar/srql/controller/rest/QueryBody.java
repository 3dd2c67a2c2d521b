package com.serviceradar.srql.controller.rest;

import com.serviceradar.srql.service.core.plan.QueryRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/** Body: {"query":"in:devices time:last_1h", "limit":50, "cursor":"..."}. */
public record QueryBody(@NotBlank String query, @Positive Long limit, String cursor) {

    QueryRequest toRequest() {
        return new QueryRequest(query, limit, cursor);
    }
}
