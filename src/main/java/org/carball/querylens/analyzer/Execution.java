package org.carball.querylens.analyzer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.carball.querylens.model.Frame;
import org.carball.querylens.storage.QueryLogJson;

import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One observation of a normalized query inside the current request.
 */
public record Execution(
        String sql,
        List<Object> bindings,
        Instant time,
        List<Frame> backtrace
) {

    private static final ObjectWriter KEY_WRITER = QueryLogJson.newMapper()
            .writer()
            .without(SerializationFeature.INDENT_OUTPUT);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Value-based key of what varies between executions of the pattern: the bindings
     * rendered as JSON, or the statement with its whitespace collapsed when its
     * literals are inlined and nothing was bound.
     */
    public String parameterKey() {
        if (bindings == null || bindings.isEmpty()) {
            return sql == null ? "" : WHITESPACE.matcher(sql.trim()).replaceAll(" ");
        }
        try {
            return KEY_WRITER.writeValueAsString(bindings);
        } catch (JsonProcessingException e) {
            return bindings.stream()
                    .map(Execution::render)
                    .collect(Collectors.joining(",", "[", "]"));
        }
    }

    private static String render(Object value) {
        if (value instanceof byte[] bytes) {
            return HexFormat.of().formatHex(bytes);
        }
        return String.valueOf(value);
    }
}
