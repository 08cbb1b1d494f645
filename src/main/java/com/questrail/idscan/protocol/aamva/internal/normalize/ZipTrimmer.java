package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.util.Objects;

/**
 * Normalizes AAMVA postal codes (DAK).
 *
 * <p>Issuers pad the postal code to a fixed width with spaces, e.g.
 * {@code "941100000 "} for a 9-digit code. Only the padding is removed; the
 * content is returned unchanged (no dash is inserted, leading zeros and
 * Canadian letters are kept).</p>
 */
public final class ZipTrimmer
{
    private ZipTrimmer() {}

    public static String normalize(String raw) {
        Objects.requireNonNull(raw, "raw");
        return raw.strip();
    }
}
