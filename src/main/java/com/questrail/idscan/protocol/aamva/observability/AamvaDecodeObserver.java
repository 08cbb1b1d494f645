package com.questrail.idscan.protocol.aamva.observability;

/**
 * Receives observability events from the AAMVA decode pipeline.
 * Implementations can provide logging, metrics, or test recording.
 *
 * <p>Callbacks are invoked synchronously on the decoding thread. A decoder may
 * be shared across threads, so implementations must be thread-safe.</p>
 */
public interface AamvaDecodeObserver {
    /**
     * Called when a body segment is not a recognized data record.
     * @param event the skipped segment details
     */
    void onRecordSkipped(AamvaRecordSkippedEvent event);

    /**
     * Called when a present element could not be resolved and is left absent.
     * @param event the degraded element
     */
    void onFieldDegraded(AamvaFieldDegradedEvent event);

    /**
     * Called when a payload is rejected.
     * @param event the failure
     */
    void onDecodeFailure(AamvaDecodeFailureEvent event);

    /**
     * Called when a payload has been decoded into an identity.
     * @param event summary of the decoded payload
     */
    void onDecoded(AamvaDecodedEvent event);
}
