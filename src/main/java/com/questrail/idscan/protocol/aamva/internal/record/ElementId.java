package com.questrail.idscan.protocol.aamva.internal.record;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ElementId
 * -----------------------------------------------------------------------------
 * Closed set of AAMVA data element identifiers understood by the decoder.
 *
 * <p>An AAMVA data record begins with a fixed 3-character element ID followed
 * immediately by its value. Any identifier not listed here is ignored by the
 * tokenizer; adding support for a new element means adding a constant here and
 * a branch in the field extractor.</p>
 *
 * <p>Reference: AAMVA DL/ID Card Design Standard, Annex D (mandatory and
 * optional data elements).</p>
 */
public enum ElementId
{
    // Name
    FULL_NAME("DAA"),
    FAMILY_NAME("DCS"),
    /** Family name as encoded by the 2000 revision of the standard. */
    FAMILY_NAME_ALT("DAB"),
    FIRST_NAME("DAC"),
    /** Given name as encoded by some jurisdictions in place of DAC. */
    FIRST_NAME_ALT("DCT"),
    MIDDLE_NAME("DAD"),

    // Identification
    CUSTOMER_ID_NUMBER("DAQ"),

    // Dates
    DATE_OF_BIRTH("DBB"),
    EXPIRATION_DATE("DBA"),
    ISSUE_DATE("DBD"),

    // Address
    STREET_ADDRESS("DAG"),
    CITY("DAI"),
    JURISDICTION_CODE("DAJ"),
    POSTAL_CODE("DAK"),

    // Physical
    HEIGHT("DAU"),
    EYE_COLOR("DAY");

    /** Length of every element identifier on the wire. */
    public static final int CODE_LENGTH = 3;

    private static final Map<String, ElementId> BY_CODE;

    static {
        Map<String, ElementId> byCode = new HashMap<>();
        for (ElementId id : values()) {
            byCode.put(id.code, id);
        }
        BY_CODE = Collections.unmodifiableMap(byCode);
    }

    private final String code;

    ElementId(String code) {
        this.code = code;
    }

    /**
     * Returns the 3-character wire code, e.g. {@code "DCS"}.
     */
    public String code() {
        return code;
    }

    /**
     * Looks up the element for a 3-character wire code.
     *
     * @param code candidate element code (case-sensitive)
     * @return the matching element, or empty if the code is not recognized
     */
    public static Optional<ElementId> fromCode(String code) {
        if (code == null || code.length() != CODE_LENGTH) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
