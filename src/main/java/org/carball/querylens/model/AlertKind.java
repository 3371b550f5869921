package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertKind {
    SLOW_QUERY("slow_query"),
    N_PLUS_ONE("n_plus_one"),
    HIGH_QUERY_COUNT("high_query_count");

    private final String code;

    AlertKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
