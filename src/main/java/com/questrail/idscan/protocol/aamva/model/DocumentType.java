package com.questrail.idscan.protocol.aamva.model;

import java.util.Optional;

/**
 * Kind of credential carried by an AAMVA payload, taken from its subfile
 * designator.
 */
public enum DocumentType
{
    /** Subfile {@code DL}. */
    DRIVER_LICENSE("DL"),
    /** Subfile {@code ID}. */
    IDENTIFICATION_CARD("ID");

    private final String subfileType;

    DocumentType(String subfileType) {
        this.subfileType = subfileType;
    }

    /**
     * Returns the 2-character subfile type code.
     */
    public String subfileType() {
        return subfileType;
    }

    /**
     * Maps a subfile type code to a document type. Jurisdiction-specific
     * subfiles ({@code Z?}) have no document type.
     */
    public static Optional<DocumentType> fromSubfileType(String subfileType) {
        for (DocumentType type : values()) {
            if (type.subfileType.equals(subfileType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
