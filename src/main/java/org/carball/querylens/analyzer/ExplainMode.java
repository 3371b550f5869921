package org.carball.querylens.analyzer;

public enum ExplainMode {
    EXPLAIN("EXPLAIN"),
    EXPLAIN_ANALYZE("EXPLAIN ANALYZE");

    private final String keyword;

    ExplainMode(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
