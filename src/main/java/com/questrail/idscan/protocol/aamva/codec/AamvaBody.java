package com.questrail.idscan.protocol.aamva.codec;

import com.questrail.idscan.protocol.aamva.internal.header.AamvaHeader;

import java.util.Objects;

/**
 * Result of header validation: the parsed issuer header and the remainder of
 * the payload that carries the data records.
 *
 * @param header  issuer header fields
 * @param records payload text after the header and subfile type, possibly empty
 */
public record AamvaBody(AamvaHeader header, String records)
{
    public AamvaBody {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(records, "records");
    }
}
