package com.questrail.idscan.protocol.aamva.observability;

/**
 * No-op implementation of AamvaDecodeObserver.
 */
public final class NullAamvaDecodeObserver implements AamvaDecodeObserver {
    public static final NullAamvaDecodeObserver INSTANCE = new NullAamvaDecodeObserver();

    private NullAamvaDecodeObserver() {}

    @Override
    public void onRecordSkipped(AamvaRecordSkippedEvent event) {}

    @Override
    public void onFieldDegraded(AamvaFieldDegradedEvent event) {}

    @Override
    public void onDecodeFailure(AamvaDecodeFailureEvent event) {}

    @Override
    public void onDecoded(AamvaDecodedEvent event) {}
}
