package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.util.Optional;

/**
 * FullNameSplitter
 * -----------------------------------------------------------------------------
 * Splits the composite name element (DAA) into family, given and middle names.
 *
 * <p>DAA is formatted {@code LAST,FIRST[,MIDDLE]}. Segments are mapped by
 * position and each one is passed through {@link NameCaser}. When only two
 * segments are present the second may carry the middle name after a space
 * ({@code LAST,FIRST MIDDLE}).</p>
 */
public final class FullNameSplitter
{
    private FullNameSplitter() {}

    /**
     * @param composite raw DAA value; may be {@code null}
     * @return the split name, or empty if no family name is present
     */
    public static Optional<SplitName> split(String composite) {
        if (composite == null) {
            return Optional.empty();
        }

        final String[] segments = composite.split(",", -1);
        final String last = segment(segments, 0);
        if (last == null) {
            return Optional.empty();
        }

        String first = segment(segments, 1);
        String middle = segment(segments, 2);

        if (first != null && middle == null) {
            final String[] given = first.split("\\s+", 2);
            if (given.length == 2) {
                first = given[0];
                middle = given[1];
            }
        }

        return Optional.of(new SplitName(
                NameCaser.normalize(last),
                (first == null) ? null : NameCaser.normalize(first),
                (middle == null) ? null : NameCaser.normalize(middle)));
    }

    private static String segment(String[] segments, int index) {
        if (index >= segments.length) {
            return null;
        }
        final String value = segments[index].strip();
        return value.isEmpty() ? null : value;
    }
}
