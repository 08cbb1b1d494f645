package com.questrail.idscan.protocol.aamva.codec;

import com.questrail.idscan.protocol.aamva.internal.decode.AamvaDecodeException;

/**
 * AamvaHeaderValidator
 * -----------------------------------------------------------------------------
 * First stage of the AAMVA decode pipeline.
 *
 * <p>The validator is responsible only for:</p>
 * <ul>
 *   <li>Rejecting empty payloads</li>
 *   <li>Locating the {@code ANSI } file type marker and issuer identification
 *       number within the leading characters of the payload</li>
 *   <li>Reading the header fields that are present</li>
 *   <li>Returning the payload remainder for tokenization</li>
 * </ul>
 *
 * <p>The validator is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting data records</li>
 *   <li>Deciding whether enough fields exist to build an identity</li>
 *   <li>Retrying; a payload that fails here fails for good</li>
 * </ul>
 */
public interface AamvaHeaderValidator
{
    /**
     * Validates the header of a complete raw payload.
     *
     * @param raw raw string decoded from the PDF-417 symbol; may be {@code null}
     * @return the parsed header and the payload remainder
     * @throws AamvaDecodeException with {@code EMPTY_INPUT} when {@code raw} is
     *         null or empty, {@code INVALID_FORMAT} when no issuer header can be
     *         found
     */
    AamvaBody validate(String raw);
}
