package org.carball.querylens.config;

/**
 * When the N+1 alert for a pattern fires within a request.
 */
public enum NPlusOneAlertMode {
    /** Only on the execution whose count equals the threshold exactly. */
    EXACT_THRESHOLD,
    /** Once, on the first execution at or above the threshold that passes every check. */
    FIRST_DETECTION
}
