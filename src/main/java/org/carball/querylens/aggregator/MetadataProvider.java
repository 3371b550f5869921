package org.carball.querylens.aggregator;

import org.carball.querylens.model.RequestMetadata;

/**
 * Supplied by the host: describes the request that is starting on the current thread.
 */
@FunctionalInterface
public interface MetadataProvider {

    RequestMetadata currentRequest();

    static MetadataProvider none() {
        return RequestMetadata::empty;
    }
}
