package org.carball.querylens.alert;

import org.carball.querylens.model.AlertEvent;

/**
 * A destination for alerts. Implementations must not throw for delivery failures.
 */
public interface AlertChannel {

    /**
     * Name used in the {@code alert channels} configuration list.
     */
    String name();

    void send(AlertEvent event);
}
