package com.questrail.idscan.protocol.aamva.observability;

import com.questrail.idscan.protocol.aamva.model.DocumentType;

/**
 * Record representing a successfully decoded payload.
 *
 * @param issuerIdentificationNumber 6-digit IIN from the header
 * @param documentType subfile type, or {@code null} when the header omits it
 * @param recordCount number of recognized data records consumed
 */
public record AamvaDecodedEvent(
    String issuerIdentificationNumber,
    DocumentType documentType,
    int recordCount
) {
}
