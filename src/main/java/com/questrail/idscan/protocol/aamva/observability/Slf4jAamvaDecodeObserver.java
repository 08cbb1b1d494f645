package com.questrail.idscan.protocol.aamva.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AamvaDecodeObserver that emits logs via SLF4J.
 *
 * <p>Only element codes, error kinds and counts are logged. Field values are
 * personal data and never reach the log.</p>
 */
public final class Slf4jAamvaDecodeObserver implements AamvaDecodeObserver {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAamvaDecodeObserver.class);

    @Override
    public void onRecordSkipped(AamvaRecordSkippedEvent event) {
        log.debug("AAMVA record skipped at offset {}: prefix '{}' ({})",
            event.offset(),
            event.prefix(),
            event.reason());
    }

    @Override
    public void onFieldDegraded(AamvaFieldDegradedEvent event) {
        log.info("AAMVA element {} ({}) left absent: {}",
            event.element().code(),
            event.element(),
            event.reason());
    }

    @Override
    public void onDecodeFailure(AamvaDecodeFailureEvent event) {
        log.warn("AAMVA decode failed [{}]: {}", event.error(), event.message());
    }

    @Override
    public void onDecoded(AamvaDecodedEvent event) {
        log.debug("AAMVA payload decoded: IIN {}, document {}, {} records",
            event.issuerIdentificationNumber(),
            event.documentType() != null ? event.documentType() : "UNKNOWN",
            event.recordCount());
    }
}
