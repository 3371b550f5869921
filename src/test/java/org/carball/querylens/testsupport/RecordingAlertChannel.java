package org.carball.querylens.testsupport;

import org.carball.querylens.alert.AlertChannel;
import org.carball.querylens.model.AlertEvent;
import org.carball.querylens.model.AlertKind;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingAlertChannel implements AlertChannel {

    private final String name;
    private final List<AlertEvent> events = new CopyOnWriteArrayList<>();

    public RecordingAlertChannel() {
        this("log");
    }

    public RecordingAlertChannel(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(AlertEvent event) {
        events.add(event);
    }

    public List<AlertEvent> getEvents() {
        return events;
    }

    public List<AlertEvent> eventsOfKind(AlertKind kind) {
        return events.stream()
                .filter(event -> event.kind() == kind)
                .collect(Collectors.toList());
    }
}
