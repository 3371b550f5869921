package org.carball.querylens.aggregator;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.ClassifiedQuery;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.Frame;
import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryExecutionEvent;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.model.RequestMetadata;
import org.carball.querylens.model.RequestSummary;
import org.carball.querylens.model.SlowQuerySummary;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Collects the queries of one request at a time.
 *
 * <p>Lifecycle: {@code start} moves the aggregator from idle to active,
 * {@code track} is only honoured while active, and {@code finish} returns the
 * request summary, fires the high query count alert and goes back to idle.
 * {@link #close()} finishes an active request, so a try-with-resources block
 * always reaches the terminal step.
 *
 * <p>{@link #track} never throws: any failure inside the pipeline is logged and
 * the query is simply not recorded.
 */
@Slf4j
public class RequestAggregator implements AutoCloseable {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final QueryLens engine;
    private final QueryLensConfig config;

    private RequestContext context;

    RequestAggregator(QueryLens engine) {
        this.engine = engine;
        this.config = engine.getConfig();
    }

    public synchronized String start() {
        return start(null);
    }

    public synchronized String start(String requestId) {
        return start(requestId, engine.getMetadataProvider().currentRequest());
    }

    /**
     * Starts a request. A request still active on this aggregator is discarded.
     *
     * @return the request id, generated when none is given
     */
    public synchronized String start(String requestId, RequestMetadata metadata) {
        if (context != null) {
            log.warn("Request {} was never finished; discarding {} tracked queries",
                    context.getRequestId(), context.getQueries().size());
        }

        String id = requestId != null ? requestId : UUID.randomUUID().toString();
        context = new RequestContext(id, engine.getClock().instant(), filterMetadata(metadata),
                engine.newPatternTracker());
        return id;
    }

    /**
     * Runs one executed statement through the pipeline: connection and sampling
     * checks, exclusions, backtrace capture, classification, persistence and the
     * N+1 and slow query alerts. Persistence and alerts run outside the lock.
     *
     * @return the stored record, or empty when the query was skipped
     */
    public Optional<QueryRecord> track(QueryExecutionEvent event) {
        try {
            ClassifiedQuery classified = classifyInRequest(event);
            if (classified == null) {
                return Optional.empty();
            }

            QueryRecord observed = classified.record();
            engine.getStore().append(observed);

            if (classified.hasPendingAlert()) {
                engine.getAlerts().alertNPlusOne(classified.pendingAlert());
            }
            if (observed.slowQuery()) {
                engine.getAlerts().alertSlowQuery(observed);
            }
            return Optional.of(observed);
        } catch (RuntimeException e) {
            log.error("[Query Lens] Failed to track query: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Summary of the active request so far, or an empty summary when idle.
     */
    public synchronized RequestSummary summary() {
        if (context == null) {
            return RequestSummary.empty();
        }
        return buildSummary(context);
    }

    /**
     * Ends the active request and returns its summary. Calling it while idle
     * returns an empty summary and fires nothing.
     */
    public RequestSummary finish() {
        RequestContext finished;
        RequestSummary summary;
        synchronized (this) {
            if (context == null) {
                return RequestSummary.empty();
            }
            finished = context;
            context = null;
            summary = buildSummary(finished);
        }

        try {
            engine.getAlerts().alertHighQueryCount(summary.totalQueries(), finished.getMetadata().routeOrUnknown());
        } catch (RuntimeException e) {
            log.error("[Query Lens] Failed to dispatch high query count alert: {}", e.getMessage());
        }

        log.debug("Request {} finished: {} queries, {} ms, {} slow, {} N+1",
                summary.requestId(), summary.totalQueries(), summary.totalTimeMs(),
                summary.slowQueriesCount(), summary.nPlusOneCount());
        return summary;
    }

    public synchronized boolean isActive() {
        return context != null;
    }

    public synchronized Optional<String> currentRequestId() {
        return context == null ? Optional.empty() : Optional.of(context.getRequestId());
    }

    @Override
    public void close() {
        finish();
    }

    private synchronized ClassifiedQuery classifyInRequest(QueryExecutionEvent event) {
        if (context == null) {
            log.debug("Ignoring query outside of an active request");
            return null;
        }
        if (!config.isEnabled()) {
            return null;
        }
        if (!engine.getTrackedConnections().isTracked(event.connection())) {
            log.debug("Skipping query on untracked connection {}", event.connection());
            return null;
        }
        if (!engine.getSampler().shouldSample()) {
            log.debug("Query skipped by sampling");
            return null;
        }
        if (engine.getExclusions().isExcluded(event.sql())) {
            log.debug("Query excluded: {}", event.sql());
            return null;
        }

        ClassifiedQuery classified = context.getTracker().classify(buildRecord(event));
        context.add(classified.record());
        return classified;
    }

    private QueryRecord buildRecord(QueryExecutionEvent event) {
        List<Frame> backtrace = List.of();
        String backtraceError = null;
        String source = null;

        if (config.isBacktraceEnabled()) {
            try {
                backtrace = engine.getBacktraceCollector().collect();
                source = engine.getBacktraceCollector().findOriginClass(backtrace).orElse(null);
            } catch (RuntimeException e) {
                log.debug("Backtrace capture failed: {}", e.getMessage());
                backtraceError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }
        }

        return QueryRecord.builder()
                .timestamp(engine.getClock().instant())
                .requestId(context.getRequestId())
                .connection(event.connection())
                .sql(event.sql())
                .bindings(event.bindings())
                .timeMs(event.elapsedMs())
                .metadata(recordMetadata())
                .normalizedSql(engine.getNormalizer().normalize(event.sql()))
                .queryHash(engine.getNormalizer().hash(event.sql()))
                .formattedSql(engine.getNormalizer().format(event.sql(), event.bindings()))
                .backtrace(backtrace)
                .backtraceError(backtraceError)
                .source(source)
                .build();
    }

    private RequestMetadata recordMetadata() {
        RequestMetadata metadata = context.getMetadata();
        if (!config.isCollectMemoryUsage()) {
            return metadata;
        }
        return metadata.toBuilder().memoryMb(usedMemoryMb()).build();
    }

    private RequestMetadata filterMetadata(RequestMetadata metadata) {
        if (metadata == null) {
            return RequestMetadata.empty();
        }
        return metadata.toBuilder()
                .userId(config.isCollectUserId() ? metadata.userId() : null)
                .tenantId(config.isCollectTenantId() ? metadata.tenantId() : null)
                .ip(config.isCollectIp() ? metadata.ip() : null)
                .userAgent(config.isCollectUserAgent() ? metadata.userAgent() : null)
                .memoryMb(null)
                .build();
    }

    private RequestSummary buildSummary(RequestContext request) {
        List<QueryRecord> queries = request.getQueries();

        double totalTime = queries.stream().mapToDouble(QueryRecord::timeMs).sum();
        List<SlowQuerySummary> slowQueries = queries.stream()
                .filter(QueryRecord::slowQuery)
                .map(SlowQuerySummary::from)
                .collect(Collectors.toList());
        List<NPlusOnePattern> nPlusOnePatterns = queries.stream()
                .filter(QueryRecord::hasNPlusOne)
                .map(QueryRecord::nPlusOne)
                .collect(Collectors.toList());
        long duration = Duration.between(request.getStartedAt(), Instant.now(engine.getClock())).toMillis();

        return new RequestSummary(
                request.getRequestId(),
                queries.size(),
                totalTime,
                duration,
                slowQueries.size(),
                nPlusOnePatterns.size(),
                slowQueries,
                nPlusOnePatterns,
                request.getTracker().detectedPatterns(),
                List.copyOf(queries));
    }

    private static double usedMemoryMb() {
        Runtime runtime = Runtime.getRuntime();
        double used = (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
        return Math.round(used * 100.0) / 100.0;
    }
}
