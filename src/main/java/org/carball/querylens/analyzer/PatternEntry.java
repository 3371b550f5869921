package org.carball.querylens.analyzer;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Executions of one normalized query within a request. The count is always the
 * number of recorded executions.
 */
@Getter
public class PatternEntry {

    private final String queryHash;
    private final String normalizedSql;
    private final String sqlSample;

    @Getter(AccessLevel.NONE)
    private final List<Execution> executions = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Set<String> bindingSets = new HashSet<>();

    private boolean alerted;

    @Getter(AccessLevel.NONE)
    private boolean described;
    private String location;
    private String suggestion;

    PatternEntry(String queryHash, String normalizedSql, String sqlSample) {
        this.queryHash = queryHash;
        this.normalizedSql = normalizedSql;
        this.sqlSample = sqlSample;
    }

    void record(Execution execution) {
        executions.add(execution);
        bindingSets.add(execution.parameterKey());
    }

    void markAlerted() {
        alerted = true;
    }

    boolean isDescribed() {
        return described;
    }

    /**
     * Fixes the location and suggestion reported for this pattern on first detection.
     */
    void describe(String location, String suggestion) {
        this.location = location;
        this.suggestion = suggestion;
        this.described = true;
    }

    public int count() {
        return executions.size();
    }

    public List<Execution> executions() {
        return Collections.unmodifiableList(executions);
    }

    public int distinctBindingSets() {
        return bindingSets.size();
    }

    /**
     * Whether the span between the first and the latest execution fits in the window.
     */
    public boolean withinWindow(Duration window) {
        if (executions.isEmpty()) {
            return false;
        }
        Duration span = Duration.between(executions.get(0).time(), executions.get(executions.size() - 1).time());
        return span.compareTo(window) <= 0;
    }
}
