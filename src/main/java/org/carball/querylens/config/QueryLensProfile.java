package org.carball.querylens.config;

import lombok.Getter;

import java.util.List;

/**
 * Named presets trading detection depth against overhead.
 */
@Getter
public enum QueryLensProfile {

    DEVELOPMENT("development", "Everything on: full sampling, EXPLAIN for slow queries, deep backtraces",
            100, 20, true, false) {
        @Override
        public QueryLensConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .explainAnalyze(true)
                    .collectUserAgent(true)
                    .build();
        }
    },

    STAGING("staging", "Half of all queries sampled, alerts written to the log",
            50, 10, true, true),

    PRODUCTION("production", "Low overhead: 10% sampling, short backtraces, no EXPLAIN",
            10, 5, false, true) {
        @Override
        public QueryLensConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .alertChannels(List.of("log", "webhook"))
                    .collectIp(false)
                    .build();
        }
    };

    private final String profileName;
    private final String description;
    private final int samplingPercent;
    private final int backtraceLimit;
    private final boolean analyzeSlowQueries;
    private final boolean alertsEnabled;

    QueryLensProfile(String profileName, String description, int samplingPercent, int backtraceLimit,
                     boolean analyzeSlowQueries, boolean alertsEnabled) {
        this.profileName = profileName;
        this.description = description;
        this.samplingPercent = samplingPercent;
        this.backtraceLimit = backtraceLimit;
        this.analyzeSlowQueries = analyzeSlowQueries;
        this.alertsEnabled = alertsEnabled;
    }

    public QueryLensConfig buildConfig() {
        return QueryLensConfig.builder()
                .samplingPercent(samplingPercent)
                .backtraceLimit(backtraceLimit)
                .analyzeSlowQueries(analyzeSlowQueries)
                .alertsEnabled(alertsEnabled)
                .build();
    }

    public static QueryLensProfile fromName(String name) {
        for (QueryLensProfile profile : values()) {
            if (profile.profileName.equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown profile: " + name + ". Available profiles: development, staging, production");
    }
}
