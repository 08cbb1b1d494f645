package com.questrail.idscan.protocol.aamva.model;

import com.questrail.idscan.protocol.aamva.internal.decode.AamvaError;

import java.util.Objects;

/**
 * Outcome of decoding one payload, for callers that prefer a value over a
 * thrown {@code AamvaDecodeException}.
 *
 * <p>There are exactly two terminal outcomes; which one applies is fully
 * determined by the payload and the decoder configuration.</p>
 */
public sealed interface AamvaDecodeResult
        permits AamvaDecodeResult.Success, AamvaDecodeResult.Failure
{
    boolean isSuccess();

    record Success(ParsedIdentity identity) implements AamvaDecodeResult {
        public Success {
            Objects.requireNonNull(identity, "identity");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * @param error   failure kind
     * @param field   field that failed to resolve, or {@code null}
     * @param message diagnostic text; contains no payload values
     */
    record Failure(AamvaError error, String field, String message) implements AamvaDecodeResult {
        public Failure {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
