package com.tasknexus.channel.feishu.observability;

import com.tasknexus.channel.feishu.internal.exec.ConnectionState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ChannelObservabilitySink {
    private final List<Object> events = new ArrayList<>();
    private final List<ChannelErrorEvent> warnings = new ArrayList<>();
    private final List<ChannelErrorEvent> errors = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ConnectionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onEventDropped(DroppedEventNotice event) {
        events.add(event);
    }

    @Override
    public synchronized void onWarning(ChannelErrorEvent event) {
        events.add(event);
        warnings.add(event);
    }

    @Override
    public synchronized void onError(ChannelErrorEvent event) {
        events.add(event);
        errors.add(event);
    }

    public synchronized List<ConnectionState> visitedStates() {
        return events.stream()
            .filter(e -> e instanceof ConnectionStateTransitionEvent)
            .map(e -> ((ConnectionStateTransitionEvent) e).newState())
            .collect(Collectors.toList());
    }

    public synchronized List<DroppedEventNotice> dropped(DroppedEventNotice.Reason reason) {
        return events.stream()
            .filter(e -> e instanceof DroppedEventNotice)
            .map(e -> (DroppedEventNotice) e)
            .filter(n -> n.reason() == reason)
            .collect(Collectors.toList());
    }

    public synchronized List<ChannelErrorEvent> warnings() {
        return new ArrayList<>(warnings);
    }

    public synchronized List<ChannelErrorEvent> errors() {
        return new ArrayList<>(errors);
    }
}
