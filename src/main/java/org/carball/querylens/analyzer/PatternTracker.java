package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.alert.AlertDispatcher;
import org.carball.querylens.backtrace.ApplicationFrames;
import org.carball.querylens.config.NPlusOneAlertMode;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.DetectedPattern;
import org.carball.querylens.model.ExecutionPlan;
import org.carball.querylens.model.Frame;
import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryIssue;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.parser.SqlNormalizer;
import org.carball.querylens.parser.TableNameExtractor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Classifies each query of a request: slow query, optional execution plans, and
 * N+1 detection over the executions of the same normalized statement.
 *
 * <p>A normalized query is an N+1 pattern once it ran at least {@code threshold}
 * times, the first and latest executions are no further apart than the time window,
 * and at least two distinct parameter sets were seen (see {@link Execution#parameterKey()}).
 * Identical re-executions are treated as intentional and never flagged.
 *
 * <p>State is per request; one tracker must not be shared across requests.
 */
@Slf4j
public class PatternTracker {

    static final String GENERIC_SUGGESTION =
            "Consider eager loading the related records or batching the lookups into a single query";

    private final QueryLensConfig config;
    private final SqlNormalizer normalizer;
    private final TableNameExtractor tableNames;
    private final ExecutionPlanProvider planProvider;
    private final AlertDispatcher alerts;
    private final Predicate<Frame> applicationFrames;
    private final Clock clock;

    private final Map<String, PatternEntry> patterns = new LinkedHashMap<>();

    public PatternTracker(QueryLensConfig config,
                          SqlNormalizer normalizer,
                          TableNameExtractor tableNames,
                          ExecutionPlanProvider planProvider,
                          AlertDispatcher alerts,
                          Predicate<Frame> applicationFrames,
                          Clock clock) {
        this.config = config;
        this.normalizer = normalizer;
        this.tableNames = tableNames;
        this.planProvider = planProvider;
        this.alerts = alerts;
        this.applicationFrames = applicationFrames;
        this.clock = clock;
    }

    /**
     * Returns a copy of the record enriched with the slow flag, plans, the N+1
     * pattern and the resulting issue list, dispatching any N+1 alert it raised.
     */
    public QueryRecord observe(QueryRecord record) {
        ClassifiedQuery classified = classify(record);
        if (classified.hasPendingAlert()) {
            alerts.alertNPlusOne(classified.pendingAlert());
        }
        return classified.record();
    }

    /**
     * Classifies the record like {@link #observe(QueryRecord)} but leaves the N+1
     * alert to the caller. The pattern is marked alerted when it is returned.
     */
    public ClassifiedQuery classify(QueryRecord record) {
        QueryRecord.QueryRecordBuilder enriched = record.toBuilder();
        List<QueryIssue> issues = new ArrayList<>();

        boolean slow = record.timeMs() >= config.getSlowQueryThresholdMs();
        enriched.slowQuery(slow);
        if (slow) {
            issues.add(QueryIssue.SLOW_QUERY);
        }

        if ((slow && config.isAnalyzeSlowQueries()) || config.isAnalyzeAllQueries()) {
            enriched.explain(plan(record, ExplainMode.EXPLAIN));
        }
        if ((slow && config.isExplainAnalyze()) || config.isExplainAnalyzeAllQueries()) {
            enriched.explainAnalyze(plan(record, ExplainMode.EXPLAIN_ANALYZE));
        }

        NPlusOnePattern pendingAlert = null;
        if (config.isNPlusOneEnabled()) {
            PatternEntry entry = track(record);
            if (entry != null) {
                NPlusOnePattern pattern = new NPlusOnePattern(
                        entry.getNormalizedSql(),
                        entry.count(),
                        record.route(),
                        entry.getLocation(),
                        entry.getSuggestion());
                enriched.nPlusOne(pattern);
                issues.add(QueryIssue.N_PLUS_ONE);
                if (shouldAlert(entry, config.getNPlusOneThreshold())) {
                    entry.markAlerted();
                    log.debug("N+1 pattern detected after {} executions: {}", entry.count(), entry.getNormalizedSql());
                    pendingAlert = pattern;
                }
            }
        }

        enriched.issues(issues);
        return new ClassifiedQuery(enriched.build(), pendingAlert);
    }

    /**
     * Every normalized query whose execution count reached the threshold.
     */
    public List<DetectedPattern> detectedPatterns() {
        int threshold = config.getNPlusOneThreshold();
        return patterns.values().stream()
                .filter(entry -> entry.count() >= threshold)
                .map(entry -> new DetectedPattern(entry.getQueryHash(), entry.getNormalizedSql(),
                        entry.count(), entry.distinctBindingSets()))
                .collect(Collectors.toList());
    }

    public Optional<PatternEntry> entry(String queryHash) {
        return Optional.ofNullable(patterns.get(queryHash));
    }

    public int patternCount() {
        return patterns.size();
    }

    public void reset() {
        patterns.clear();
    }

    private ExecutionPlan plan(QueryRecord record, ExplainMode mode) {
        try {
            return planProvider.explain(record.sql(), record.bindings(), record.connection(), mode);
        } catch (RuntimeException e) {
            log.warn("{} failed for query on {}: {}", mode.getKeyword(), record.connection(), e.getMessage());
            return ExecutionPlan.failed(e.getMessage());
        }
    }

    /**
     * Records the execution and returns its entry when it now forms an N+1 pattern.
     */
    private PatternEntry track(QueryRecord record) {
        String normalized = record.normalizedSql() != null ? record.normalizedSql() : normalizer.normalize(record.sql());
        String hash = record.queryHash() != null ? record.queryHash() : normalizer.hash(record.sql());

        PatternEntry entry = patterns.computeIfAbsent(hash, key -> new PatternEntry(key, normalized, record.sql()));
        entry.record(new Execution(record.sql(), record.bindings(), clock.instant(), record.backtrace()));

        if (entry.count() < config.getNPlusOneThreshold()
                || !entry.withinWindow(Duration.ofMillis(config.getNPlusOneTimeWindowMs()))
                || entry.distinctBindingSets() < 2) {
            return null;
        }

        if (!entry.isDescribed()) {
            entry.describe(findCommonCodePath(entry), suggestFix(entry));
        }
        return entry;
    }

    private boolean shouldAlert(PatternEntry entry, int threshold) {
        if (entry.isAlerted()) {
            return false;
        }
        if (config.getNPlusOneAlertMode() == NPlusOneAlertMode.FIRST_DETECTION) {
            return true;
        }
        return entry.count() == threshold;
    }

    private String findCommonCodePath(PatternEntry entry) {
        return ApplicationFrames.firstMatch(entry.executions().get(0).backtrace(), applicationFrames)
                .map(Frame::describe)
                .orElse(null);
    }

    private String suggestFix(PatternEntry entry) {
        return tableNames.primaryTable(entry.getSqlSample())
                .map(table -> "Consider eager loading the '" + table
                        + "' records for the whole collection, or fetching them with a single IN (...) query")
                .orElse(GENERIC_SUGGESTION);
    }
}
