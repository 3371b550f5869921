package org.carball.querylens.aggregator;

import lombok.Getter;
import org.carball.querylens.analyzer.PatternTracker;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.model.RequestMetadata;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything accumulated for one request between start and finish.
 */
@Getter
public class RequestContext {

    private final String requestId;
    private final Instant startedAt;
    private final RequestMetadata metadata;
    private final PatternTracker tracker;
    private final List<QueryRecord> queries = new ArrayList<>();

    RequestContext(String requestId, Instant startedAt, RequestMetadata metadata, PatternTracker tracker) {
        this.requestId = requestId;
        this.startedAt = startedAt;
        this.metadata = metadata;
        this.tracker = tracker;
    }

    void add(QueryRecord record) {
        queries.add(record);
    }

    public List<QueryRecord> getQueries() {
        return Collections.unmodifiableList(queries);
    }
}
