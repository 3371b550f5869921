package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One stack frame captured at the point a query was executed.
 */
public record Frame(
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("class") String className,
        @JsonProperty("function") String function
) {

    public String describe() {
        return className + "::" + function + " (" + file + ":" + line + ")";
    }
}
