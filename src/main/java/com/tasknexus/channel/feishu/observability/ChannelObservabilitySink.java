package com.tasknexus.channel.feishu.observability;

/**
 * Receives observability events from the Feishu channel's connection
 * supervisor and inbound dispatch path.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from both the caller's thread and the long connection
 * thread. Implementations must be thread-safe and must not throw.</p>
 */
public interface ChannelObservabilitySink {
    /**
     * Called when the connection state changes.
     * @param event the transition details
     */
    void onStateTransition(ConnectionStateTransitionEvent event);

    /**
     * Called when an inbound event is dropped before reaching the consumer.
     * @param event the dropped event and the reason
     */
    void onEventDropped(DroppedEventNotice event);

    /**
     * Called for anomalies that do not stop the channel on their own
     * (readiness timeout, connection thread death, shutdown problems).
     * @param event the anomaly
     */
    void onWarning(ChannelErrorEvent event);

    /**
     * Called when an error occurs in the channel.
     * @param event the error event
     */
    void onError(ChannelErrorEvent event);
}
