package com.questrail.idscan.protocol.aamva.observability;

import com.questrail.idscan.protocol.aamva.internal.record.ElementId;

/**
 * Record describing an element that was present in the payload but could not
 * be resolved, and was therefore left absent in the result.
 */
public record AamvaFieldDegradedEvent(
    ElementId element,
    String reason
) {
}
