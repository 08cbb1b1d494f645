package com.questrail.idscan.protocol.aamva.internal.decode;

import java.util.Objects;
import java.util.Optional;

/**
 * Indicates that a raw barcode payload could not be decoded into a
 * {@code ParsedIdentity}.
 *
 * This typically reflects:
 * <ul>
 *   <li>An empty payload</li>
 *   <li>A payload without a recognizable {@code ANSI } issuer header</li>
 *   <li>A payload from which no name can be derived</li>
 *   <li>A required field whose value cannot be resolved</li>
 * </ul>
 *
 * The failure is deterministic for a given payload; the caller decides
 * whether to re-scan.
 */
public final class AamvaDecodeException extends RuntimeException
{
    private final AamvaError error;
    private final String field;

    public AamvaDecodeException(AamvaError error, String message) {
        this(error, null, message);
    }

    public AamvaDecodeException(AamvaError error, String field, String message) {
        super(error.description() + ": " + message);
        this.error = Objects.requireNonNull(error, "error");
        this.field = field;
    }

    public AamvaDecodeException(AamvaError error, String message, Throwable cause) {
        super(error.description() + ": " + message, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.field = null;
    }

    public AamvaError error() {
        return error;
    }

    /**
     * Name of the field that failed to resolve, for {@link AamvaError#PARSING_FAILED}.
     */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }
}
