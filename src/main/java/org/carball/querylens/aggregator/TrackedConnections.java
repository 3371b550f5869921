package org.carball.querylens.aggregator;

import org.carball.querylens.config.QueryLensConfig;

import java.util.List;
import java.util.Set;

/**
 * Connection names whose queries are tracked; {@code *} tracks every connection.
 */
public class TrackedConnections {

    private final Set<String> names;
    private final boolean all;

    public TrackedConnections(List<String> names) {
        this.names = Set.copyOf(names);
        this.all = this.names.contains(QueryLensConfig.ALL_CONNECTIONS);
    }

    public boolean isTracked(String connection) {
        return all || (connection != null && names.contains(connection));
    }
}
