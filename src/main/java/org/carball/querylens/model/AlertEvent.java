package org.carball.querylens.model;

import java.util.Map;

/**
 * A notification built by the alert dispatcher. Never persisted.
 */
public record AlertEvent(
        String title,
        AlertKind kind,
        Map<String, Object> payload
) {}
