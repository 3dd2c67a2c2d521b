package com.serviceradar.srql.service.core.stats;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import com.serviceradar.srql.service.core.parser.SrqlTokenizer;
import com.serviceradar.srql.service.core.sql.BindParam;
import com.serviceradar.srql.service.core.sql.ColumnHandler;
import com.serviceradar.srql.service.core.sql.CompiledQuery;
import com.serviceradar.srql.service.core.sql.EntityTable;
import com.serviceradar.srql.service.core.sql.SqlClauses;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trace summary counters, e.g.
 * {@code count() as total, sum(if(status_code != 0, 1, 0)) as errors, sum(if(duration_ms > 1000, 1, 0)) as slow}.
 */
public final class ConditionalSumStats {

    private static final Pattern COUNT = Pattern.compile("^count\\( ?\\*? ?\\) as (\\S+)$");
    private static final Pattern STATUS = Pattern.compile(
            "^sum\\( ?if\\( ?status_code ?(==|=|!=|<>) ?(-?\\d+) ?, ?1 ?, ?0 ?\\) ?\\) as (\\S+)$");
    private static final Pattern DURATION = Pattern.compile(
            "^sum\\( ?if\\( ?duration_ms ?(>=|>) ?(\\d+(?:\\.\\d+)?) ?, ?1 ?, ?0 ?\\) ?\\) as (\\S+)$");

    private ConditionalSumStats() {}

    public static CompiledQuery compile(EntityTable table, String expression, SqlClauses where) {
        List<String> terms = SrqlTokenizer.splitTopLevel(expression, ',');
        if (terms.isEmpty()) {
            throw new InvalidRequestException("stats expression cannot be empty");
        }
        if (terms.size() > StatsQueries.MAX_EXPRESSIONS) {
            throw new InvalidRequestException("stats supports at most " + StatsQueries.MAX_EXPRESSIONS + " expressions");
        }

        List<String> args = new ArrayList<>();
        List<BindParam> binds = new ArrayList<>();
        Set<String> aliases = new HashSet<>();
        for (String raw : terms) {
            String term = StatsQueries.normalize(raw);
            if (!term.contains(" as ")) {
                throw new InvalidRequestException("stats expression must include an alias");
            }
            String alias;
            String fragment;
            Matcher m;
            if ((m = COUNT.matcher(term)).matches()) {
                alias = m.group(1);
                fragment = "coalesce(COUNT(*), 0)";
            } else if ((m = STATUS.matcher(term)).matches()) {
                alias = m.group(3);
                String op = m.group(1).equals("=") || m.group(1).equals("==") ? "=" : "<>";
                fragment = "coalesce(SUM(CASE WHEN coalesce(status_code, 0) " + op + " ? THEN 1 ELSE 0 END), 0)";
                binds.add(new BindParam.Int(ColumnHandler.parseInteger("status_code", m.group(2))));
            } else if ((m = DURATION.matcher(term)).matches()) {
                alias = m.group(3);
                fragment = "coalesce(SUM(CASE WHEN duration_ms " + m.group(1) + " ? THEN 1 ELSE 0 END), 0)";
                binds.add(new BindParam.Float(ColumnHandler.parseFloat("duration_ms", m.group(2))));
            } else {
                throw new InvalidRequestException("unsupported trace summary stats expression '" + raw.trim() + "'");
            }
            alias = StatsQueries.sanitizeAlias(alias);
            if (!aliases.add(alias)) {
                throw new InvalidRequestException("duplicate stats alias '" + alias + "'");
            }
            args.add("'" + alias + "', " + fragment);
        }
        return StatsQueries.single(String.join(", ", args), binds, table.table(), where);
    }
}
