package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.ExecutionPlan;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Explains statements over plain JDBC. {@code EXPLAIN ANALYZE} first asks for a
 * JSON plan and falls back to the text form when the database rejects it.
 */
@Slf4j
public class JdbcExecutionPlanProvider implements ExecutionPlanProvider {

    private static final Pattern ALREADY_EXPLAINED = Pattern.compile("^\\s*EXPLAIN\\b", Pattern.CASE_INSENSITIVE);

    static final String FORMAT_TABLE = "table";
    static final String FORMAT_JSON = "json";
    static final String FORMAT_TEXT = "text";

    private final ConnectionResolver connections;

    public JdbcExecutionPlanProvider(ConnectionResolver connections) {
        this.connections = connections;
    }

    @Override
    public ExecutionPlan explain(String sql, List<Object> bindings, String connection, ExplainMode mode) {
        if (sql == null || ALREADY_EXPLAINED.matcher(sql).find()) {
            return null;
        }

        if (mode == ExplainMode.EXPLAIN) {
            try {
                return ExecutionPlan.of(FORMAT_TABLE, query("EXPLAIN " + sql, bindings, connection));
            } catch (SQLException e) {
                log.debug("EXPLAIN failed on connection {}: {}", connection, e.getMessage());
                return ExecutionPlan.failed(e.getMessage());
            }
        }

        try {
            return ExecutionPlan.of(FORMAT_JSON, query("EXPLAIN ANALYZE FORMAT=JSON " + sql, bindings, connection));
        } catch (SQLException jsonFailure) {
            log.debug("EXPLAIN ANALYZE FORMAT=JSON not supported on {}, retrying as text: {}",
                    connection, jsonFailure.getMessage());
            try {
                return ExecutionPlan.of(FORMAT_TEXT, query("EXPLAIN ANALYZE " + sql, bindings, connection));
            } catch (SQLException textFailure) {
                log.debug("EXPLAIN ANALYZE failed on connection {}: {}", connection, textFailure.getMessage());
                return ExecutionPlan.failed(jsonFailure.getMessage(), textFailure.getMessage());
            }
        }
    }

    private List<Map<String, Object>> query(String explainSql, List<Object> bindings, String connection)
            throws SQLException {
        try (Connection jdbc = connections.connect(connection);
             PreparedStatement statement = jdbc.prepareStatement(explainSql)) {

            for (int i = 0; i < bindings.size(); i++) {
                statement.setObject(i + 1, bindings.get(i));
            }

            try (ResultSet resultSet = statement.executeQuery()) {
                return readRows(resultSet);
            }
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columns = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();

        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int column = 1; column <= columns; column++) {
                row.put(metaData.getColumnLabel(column), plainValue(resultSet.getObject(column)));
            }
            rows.add(row);
        }
        return rows;
    }

    // Driver-specific types (CLOBs, PGobject, ...) are stored as their string form.
    private static Object plainValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } catch (SQLException e) {
                log.debug("Could not read CLOB plan column: {}", e.getMessage());
                return null;
            }
        }
        return value.toString();
    }
}
