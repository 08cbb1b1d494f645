package com.questrail.idscan.protocol.aamva.internal.header;

import com.questrail.idscan.protocol.aamva.model.DocumentType;

import java.util.List;
import java.util.Objects;

/**
 * AamvaHeader
 * -----------------------------------------------------------------------------
 * Immutable view of the issuer header that follows the {@code ANSI } marker.
 *
 * <pre>
 *   ANSI 636045 09 00 02 DL00410278 ZC03200024
 *        IIN    |  |  |  designators...
 *               |  |  number of entries
 *               |  jurisdiction version (version 2 and later)
 *               AAMVA version
 * </pre>
 *
 * <p>Only the IIN is mandatory. Every other field is {@code null} (or the
 * designator list empty) when the payload truncates the header.</p>
 */
public record AamvaHeader(
        String issuerIdentificationNumber,
        Integer version,
        Integer jurisdictionVersion,
        Integer numberOfEntries,
        List<SubfileDesignator> subfiles,
        DocumentType documentType
)
{
    public AamvaHeader {
        Objects.requireNonNull(issuerIdentificationNumber, "issuerIdentificationNumber");
        subfiles = (subfiles == null) ? List.of() : List.copyOf(subfiles);
    }
}
