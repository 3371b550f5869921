package org.carball.querylens.aggregator;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Statements that are never tracked: plan requests issued by the engine itself
 * and anything matching one of the configured patterns.
 */
public class QueryExclusions {

    private static final Pattern EXPLAIN_STATEMENT = Pattern.compile("^\\s*EXPLAIN\\b", Pattern.CASE_INSENSITIVE);

    private final List<Pattern> patterns;

    public QueryExclusions(List<String> regexes) {
        this.patterns = regexes.stream()
                .map(Pattern::compile)
                .collect(Collectors.toList());
    }

    public boolean isExcluded(String sql) {
        if (sql == null) {
            return true;
        }
        if (EXPLAIN_STATEMENT.matcher(sql).find()) {
            return true;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(sql).find()) {
                return true;
            }
        }
        return false;
    }
}
