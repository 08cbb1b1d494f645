package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.util.Objects;
import java.util.Optional;

/**
 * Name parts recovered from a composite DAA value, already cased.
 *
 * @param last   family name, never blank
 * @param first  given name, or {@code null}
 * @param middle middle name(s), or {@code null}
 */
public record SplitName(String last, String first, String middle)
{
    public SplitName {
        Objects.requireNonNull(last, "last");
        if (last.isBlank()) {
            throw new IllegalArgumentException("last must not be blank");
        }
    }

    public Optional<String> firstName() {
        return Optional.ofNullable(first);
    }

    public Optional<String> middleName() {
        return Optional.ofNullable(middle);
    }
}
