package com.serviceradar.srql.service.core.engine;

import com.serviceradar.srql.service.core.sql.CompiledQuery;
import java.util.List;
import java.util.Map;

/** Runs compiled SQL against the store. Pooling, retries and transactions belong to the implementation. */
public interface QueryExecutor {

    List<Map<String, Object>> execute(CompiledQuery query);
}
