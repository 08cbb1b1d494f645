package com.questrail.idscan.protocol.aamva.internal.decode;

/**
 * Closed set of failure kinds reported by the AAMVA decoder.
 *
 * <ul>
 *   <li>{@link #EMPTY_INPUT} and {@link #INVALID_FORMAT} are raised while the
 *       payload header is validated, or when no name can be derived from an
 *       otherwise valid payload.</li>
 *   <li>{@link #PARSING_FAILED} is raised only for a field the active
 *       configuration treats as structurally required (the date of birth
 *       under {@code DateOfBirthPolicy.STRICT}).</li>
 * </ul>
 */
public enum AamvaError
{
    EMPTY_INPUT("No barcode data provided"),
    INVALID_FORMAT("Invalid AAMVA barcode format"),
    PARSING_FAILED("Failed to parse field");

    private final String description;

    AamvaError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
