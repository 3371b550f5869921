package org.carball.querylens.analyzer;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Hands out a JDBC connection for a logical connection name.
 */
@FunctionalInterface
public interface ConnectionResolver {

    Connection connect(String connectionName) throws SQLException;

    static ConnectionResolver fromDataSources(Map<String, DataSource> dataSources) {
        Map<String, DataSource> byName = Map.copyOf(dataSources);
        return connectionName -> {
            DataSource dataSource = byName.get(connectionName);
            if (dataSource == null) {
                throw new SQLException("Unknown connection: " + connectionName);
            }
            return dataSource.getConnection();
        };
    }
}
