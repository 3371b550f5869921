package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.LogAnalysis;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.storage.JsonFileQueryStore;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Offline statistics over one day of the persisted query log.
 */
@Slf4j
public class QueryLogAnalyzer {

    public static final int TOP_ENTRIES = 20;

    private final JsonFileQueryStore store;
    private final double slowQueryThresholdMs;

    public QueryLogAnalyzer(JsonFileQueryStore store, double slowQueryThresholdMs) {
        this.store = store;
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    public LogAnalysis analyze(LocalDate date, AnalysisFilter filter) {
        List<QueryRecord> records = store.read(date).stream()
                .filter(record -> !filter.slowOnly() || record.timeMs() >= slowQueryThresholdMs)
                .filter(record -> !filter.nPlusOneOnly() || record.hasNPlusOne())
                .limit(Math.max(filter.limit(), 0))
                .collect(Collectors.toList());

        log.debug("Analyzing {} query log record(s) for {}", records.size(), date);

        double totalTime = records.stream().mapToDouble(QueryRecord::timeMs).sum();
        double averageTime = records.isEmpty() ? 0.0 : totalTime / records.size();

        List<QueryRecord> slowQueries = records.stream()
                .filter(QueryRecord::slowQuery)
                .collect(Collectors.toList());
        List<QueryRecord> nPlusOneQueries = records.stream()
                .filter(QueryRecord::hasNPlusOne)
                .collect(Collectors.toList());

        return new LogAnalysis(
                date,
                records.size(),
                totalTime,
                averageTime,
                slowQueries.size(),
                nPlusOneQueries.size(),
                slowQueries.stream()
                        .sorted(Comparator.comparingDouble(QueryRecord::timeMs).reversed())
                        .limit(TOP_ENTRIES)
                        .collect(Collectors.toList()),
                nPlusOneQueries.stream()
                        .limit(TOP_ENTRIES)
                        .collect(Collectors.toList()));
    }
}
