package org.carball.querylens.analyzer;

/**
 * Selection applied to one day of the query log before it is summarised.
 *
 * @param slowOnly     keep records at or above the slow query threshold
 * @param nPlusOneOnly keep records that carry an N+1 pattern
 * @param limit        maximum number of records kept after filtering
 */
public record AnalysisFilter(boolean slowOnly, boolean nPlusOneOnly, int limit) {

    public static final int DEFAULT_LIMIT = 50;

    public static AnalysisFilter all() {
        return new AnalysisFilter(false, false, DEFAULT_LIMIT);
    }
}
