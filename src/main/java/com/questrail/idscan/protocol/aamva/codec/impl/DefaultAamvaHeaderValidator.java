package com.questrail.idscan.protocol.aamva.codec.impl;

import com.questrail.idscan.protocol.aamva.codec.AamvaBody;
import com.questrail.idscan.protocol.aamva.codec.AamvaHeaderValidator;
import com.questrail.idscan.protocol.aamva.internal.decode.AamvaDecodeException;
import com.questrail.idscan.protocol.aamva.internal.decode.AamvaError;

/**
 * DefaultAamvaHeaderValidator
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AamvaHeaderValidator}.
 *
 * <p>This validator performs the following steps, in order:</p>
 * <ol>
 *   <li>Empty check</li>
 *   <li>File type ({@code "ANSI "}) search within the leading window</li>
 *   <li>IIN, version, entry count and designator reading</li>
 *   <li>Subfile type removal</li>
 * </ol>
 */
public final class DefaultAamvaHeaderValidator implements AamvaHeaderValidator
{
    private final int headerSearchWindow;

    /**
     * @param headerSearchWindow number of leading characters in which the
     *                           {@code "ANSI "} marker must start
     */
    public DefaultAamvaHeaderValidator(int headerSearchWindow) {
        if (headerSearchWindow < 1) {
            throw new IllegalArgumentException("headerSearchWindow must be positive (was " + headerSearchWindow + ")");
        }
        this.headerSearchWindow = headerSearchWindow;
    }

    @Override
    public AamvaBody validate(String raw)
    {
        if (raw == null || raw.isEmpty()) {
            throw new AamvaDecodeException(AamvaError.EMPTY_INPUT, "payload is empty");
        }

        try {
            return AamvaHeaderReader.read(raw, headerSearchWindow);
        }
        catch (HeaderFormatException e) {
            throw new AamvaDecodeException(AamvaError.INVALID_FORMAT, e.getMessage(), e);
        }
    }
}
