package org.carball.querylens.aggregator;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.QueryExecutionEvent;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.model.RequestMetadata;
import org.carball.querylens.model.RequestSummary;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of in-flight requests keyed by request id, for hosts where queries of
 * one request may arrive on different threads.
 */
@Slf4j
public class ActiveRequests {

    private final QueryLens engine;
    private final ConcurrentMap<String, RequestAggregator> requests = new ConcurrentHashMap<>();

    public ActiveRequests(QueryLens engine) {
        this.engine = engine;
    }

    public String start(String requestId, RequestMetadata metadata) {
        RequestAggregator aggregator = engine.newAggregator();
        String id = aggregator.start(requestId, metadata);
        RequestAggregator previous = requests.put(id, aggregator);
        if (previous != null) {
            log.warn("Request id {} was already active; the earlier request is discarded", id);
        }
        return id;
    }

    public Optional<QueryRecord> track(String requestId, QueryExecutionEvent event) {
        RequestAggregator aggregator = requests.get(requestId);
        if (aggregator == null) {
            log.debug("Ignoring query for unknown request {}", requestId);
            return Optional.empty();
        }
        return aggregator.track(event);
    }

    public Optional<RequestSummary> finish(String requestId) {
        RequestAggregator aggregator = requests.remove(requestId);
        if (aggregator == null) {
            return Optional.empty();
        }
        return Optional.of(aggregator.finish());
    }

    public Optional<RequestAggregator> get(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    public int size() {
        return requests.size();
    }
}
