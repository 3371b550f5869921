package org.carball.querylens.alert;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.AlertEvent;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Writes alerts as structured warnings: one key/value pair per payload field.
 */
@Slf4j
public class LogAlertChannel implements AlertChannel {

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(AlertEvent event) {
        LoggingEventBuilder warning = log.atWarn()
                .setMessage("[Query Lens] {}")
                .addArgument(event.title())
                .addKeyValue("type", event.kind().getCode());
        event.payload().forEach(warning::addKeyValue);
        warning.log();
    }
}
