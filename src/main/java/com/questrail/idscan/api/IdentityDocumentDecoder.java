package com.questrail.idscan.api;

/**
 * IdentityDocumentDecoder
 * -----------------------------------------------------------------------------
 * {@code IdentityDocumentDecoder} is the boundary between a scanning workflow
 * (age verification, customer identification) and the format-specific code
 * that turns the text read from an identity document into a structured
 * identity.
 *
 * <h2>Core Responsibilities</h2>
 * An {@code IdentityDocumentDecoder} is responsible for:
 * <ul>
 *   <li>Deciding whether a payload is in its format at all</li>
 *   <li>Extracting and normalizing identity fields</li>
 *   <li>Reporting a typed failure when it cannot</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Capturing or optically decoding the document</li>
 *   <li>Matching the identity against stored customers</li>
 *   <li>Making age or acceptance decisions</li>
 *   <li>Persisting or transmitting the decoded data</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Implementations are stateless between calls and may be shared across
 * threads. A call either returns an identity or throws; there is no partial
 * or asynchronous result.
 *
 * @param <T> identity type produced by the decoder
 */
public interface IdentityDocumentDecoder<T>
{
    /**
     * Decodes one payload.
     *
     * @param payload text recovered from the document
     * @return the decoded identity
     * @throws RuntimeException an implementation-specific exception describing
     *         why the payload was rejected
     */
    T parse(String payload);
}
