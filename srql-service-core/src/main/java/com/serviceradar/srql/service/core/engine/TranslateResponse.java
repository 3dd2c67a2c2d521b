package com.serviceradar.srql.service.core.engine;

import com.serviceradar.srql.service.core.plan.PaginationMeta;
import com.serviceradar.srql.service.core.sql.BindParam;
import java.util.List;

/** Compiled SQL with {@code $n} placeholders and the binds that go with it, without executing anything. */
public record TranslateResponse(String sql, List<BindParam> params, PaginationMeta pagination) {}
