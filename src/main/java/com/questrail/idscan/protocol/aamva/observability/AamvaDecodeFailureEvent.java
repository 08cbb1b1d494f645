package com.questrail.idscan.protocol.aamva.observability;

import com.questrail.idscan.protocol.aamva.internal.decode.AamvaError;

/**
 * Record representing a rejected payload.
 */
public record AamvaDecodeFailureEvent(
    AamvaError error,
    String message
) {
}
