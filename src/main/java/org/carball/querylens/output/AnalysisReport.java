package org.carball.querylens.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.QueryLogAnalyzer;
import org.carball.querylens.model.LogAnalysis;
import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.storage.QueryLogJson;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link LogAnalysis} for the terminal or as JSON.
 */
@Slf4j
public class AnalysisReport {

    private static final int SQL_PREVIEW_LENGTH = 80;

    private final LogAnalysis analysis;
    private final ObjectMapper objectMapper;

    public AnalysisReport(LogAnalysis analysis) {
        this.analysis = analysis;
        this.objectMapper = QueryLogJson.newMapper();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toText() {
        StringBuilder text = new StringBuilder();

        text.append("Query Lens analysis for ").append(analysis.date()).append("\n\n");

        if (analysis.totalQueries() == 0) {
            text.append("No queries found.\n");
            return text.toString();
        }

        text.append("| Metric | Value |\n");
        text.append("|--------|-------|\n");
        text.append("| Total Queries | ").append(analysis.totalQueries()).append(" |\n");
        text.append("| Total Time | ").append(ms(analysis.totalTimeMs())).append(" |\n");
        text.append("| Average Time | ").append(ms(analysis.averageTimeMs())).append(" |\n");
        text.append("| Slow Queries | ").append(analysis.slowQueriesCount()).append(" |\n");
        text.append("| N+1 Queries | ").append(analysis.nPlusOneCount()).append(" |\n\n");

        if (!analysis.slowQueries().isEmpty()) {
            text.append("Slow Queries\n\n");
            text.append("| Time | Route | SQL |\n");
            text.append("|------|-------|-----|\n");
            for (QueryRecord record : analysis.slowQueries()) {
                text.append("| ").append(ms(record.timeMs()))
                        .append(" | ").append(record.route())
                        .append(" | ").append(preview(record.sql())).append(" |\n");
            }
            appendTruncationNote(text, analysis.slowQueriesCount(), analysis.slowQueries());
            text.append("\n");
        }

        if (!analysis.nPlusOneQueries().isEmpty()) {
            text.append("N+1 Patterns\n\n");
            text.append("| Count | Route | Pattern | Suggestion |\n");
            text.append("|-------|-------|---------|------------|\n");
            for (QueryRecord record : analysis.nPlusOneQueries()) {
                NPlusOnePattern pattern = record.nPlusOne();
                text.append("| ").append(pattern.count())
                        .append(" | ").append(pattern.route())
                        .append(" | ").append(preview(pattern.queryPattern()))
                        .append(" | ").append(pattern.suggestion()).append(" |\n");
            }
            appendTruncationNote(text, analysis.nPlusOneCount(), analysis.nPlusOneQueries());
        }

        return text.toString();
    }

    private static void appendTruncationNote(StringBuilder text, int total, List<QueryRecord> shown) {
        if (total > shown.size()) {
            text.append("\nShowing first ").append(QueryLogAnalyzer.TOP_ENTRIES)
                    .append(" of ").append(total).append("\n");
        }
    }

    private static String ms(double value) {
        return String.format(Locale.ROOT, "%.2f ms", value);
    }

    private static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        String singleLine = sql.replaceAll("\\s+", " ").replace("|", "\\|");
        if (singleLine.length() <= SQL_PREVIEW_LENGTH) {
            return singleLine;
        }
        return singleLine.substring(0, SQL_PREVIEW_LENGTH - 3) + "...";
    }
}
