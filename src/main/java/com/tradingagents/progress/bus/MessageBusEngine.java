package com.tradingagents.progress.bus;

import com.tradingagents.progress.message.Envelope;

/**
 * Transport behind the message router.
 * <p>
 * Implementations never throw from {@link #publish}, {@link #subscribe} or {@link #unsubscribe}:
 * transport failures are logged and reported as {@code false}, so a broken bus cannot abort
 * an analysis job. Delivery guarantees differ per backend, see {@link BusEngineType}.
 */
public interface MessageBusEngine {

    /** Establish the transport connection. Idempotent when already connected. */
    boolean connect();

    /** Release transport resources. Safe to call when not connected. */
    void disconnect();

    boolean publish(String topic, Envelope envelope);

    /**
     * Register a callback for a topic or a wildcard filter ({@code *} one segment, {@code #} the rest).
     * Several callbacks per filter are allowed and each receives every message.
     */
    boolean subscribe(String topicFilter, EnvelopeCallback callback);

    /** Drop every callback registered under the filter */
    boolean unsubscribe(String topicFilter);

    boolean isConnected();

    BusEngineType type();
}
