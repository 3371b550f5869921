package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryIssue {
    SLOW_QUERY("slow_query"),
    N_PLUS_ONE("n_plus_one");

    private final String code;

    QueryIssue(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
