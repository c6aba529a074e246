package com.questrail.acars.splitter.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SplitterObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onMessageRouted(MessageRoutedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSourceAnomaly(SourceAnomalyEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportStateEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SplitterErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<MessageRoutedEvent> getRoutedMessages() {
        return eventsOfType(MessageRoutedEvent.class);
    }

    public synchronized List<SourceAnomalyEvent> getAnomalies() {
        return eventsOfType(SourceAnomalyEvent.class);
    }

    public synchronized List<TransportStateEvent> getTransportEvents() {
        return eventsOfType(TransportStateEvent.class);
    }

    public synchronized List<SplitterErrorEvent> getErrors() {
        return eventsOfType(SplitterErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    public synchronized void clear() {
        events.clear();
    }

    private <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
