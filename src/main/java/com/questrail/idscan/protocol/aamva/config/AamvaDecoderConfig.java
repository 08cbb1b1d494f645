package com.questrail.idscan.protocol.aamva.config;

import java.util.Objects;

/**
 * Aggregated configuration for the AAMVA decoder.
 *
 * @param headerSearchWindow number of leading characters in which the
 *                           {@code "ANSI "} file type must start
 * @param dateOfBirthPolicy  handling of an unresolvable date of birth
 */
public record AamvaDecoderConfig(
    int headerSearchWindow,
    DateOfBirthPolicy dateOfBirthPolicy
) {
    public static final int DEFAULT_HEADER_SEARCH_WINDOW = 64;

    public AamvaDecoderConfig {
        Objects.requireNonNull(dateOfBirthPolicy, "dateOfBirthPolicy");
        if (headerSearchWindow < 1) {
            throw new IllegalArgumentException("headerSearchWindow must be positive (was " + headerSearchWindow + ")");
        }
    }

    public static AamvaDecoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int headerSearchWindow = DEFAULT_HEADER_SEARCH_WINDOW;
        private DateOfBirthPolicy dateOfBirthPolicy = DateOfBirthPolicy.STRICT;

        public Builder withHeaderSearchWindow(int headerSearchWindow) {
            this.headerSearchWindow = headerSearchWindow;
            return this;
        }

        public Builder withDateOfBirthPolicy(DateOfBirthPolicy dateOfBirthPolicy) {
            this.dateOfBirthPolicy = dateOfBirthPolicy;
            return this;
        }

        public AamvaDecoderConfig build() {
            return new AamvaDecoderConfig(headerSearchWindow, dateOfBirthPolicy);
        }
    }
}
