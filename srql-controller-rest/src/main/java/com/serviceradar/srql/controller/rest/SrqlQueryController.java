package com.serviceradar.srql.controller.rest;

import com.serviceradar.srql.service.core.engine.QueryEngine;
import com.serviceradar.srql.service.core.engine.QueryResponse;
import com.serviceradar.srql.service.core.engine.TranslateResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SrqlQueryController {

    private final QueryEngine engine;

    /** Runs an SRQL query and returns its rows plus paging cursors. */
    @PostMapping(
            value = "/query",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public QueryResponse query(@Valid @RequestBody QueryBody body) {
        return engine.executeQuery(body.toRequest());
    }

    /** Returns the SQL and binds an SRQL query compiles to, without running it. */
    @PostMapping(
            value = "/translate",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public TranslateResponse translate(@Valid @RequestBody QueryBody body) {
        return engine.translate(body.toRequest());
    }
}
