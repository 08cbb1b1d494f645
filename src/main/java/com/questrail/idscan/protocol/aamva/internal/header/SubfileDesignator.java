package com.questrail.idscan.protocol.aamva.internal.header;

import java.util.Objects;

/**
 * One subfile designator from the AAMVA header: a 2-character subfile type
 * followed by the 4-digit offset and 4-digit length of that subfile.
 *
 * <p>Offsets and lengths are reported as read. The decoder does not use them
 * to slice the payload, because issuers are inconsistent about whether they
 * count the compliance preamble.</p>
 */
public record SubfileDesignator(String type, int offset, int length)
{
    public SubfileDesignator {
        Objects.requireNonNull(type, "type");
        if (type.length() != 2) {
            throw new IllegalArgumentException("Subfile type must be 2 characters (was '" + type + "')");
        }
    }
}
