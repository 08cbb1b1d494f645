package com.questrail.idscan.protocol.aamva.codec.impl;

import com.questrail.idscan.protocol.aamva.codec.AamvaBody;
import com.questrail.idscan.protocol.aamva.internal.header.AamvaHeader;
import com.questrail.idscan.protocol.aamva.internal.header.SubfileDesignator;
import com.questrail.idscan.protocol.aamva.model.DocumentType;

import java.util.ArrayList;
import java.util.List;

/**
 * AamvaHeaderReader
 * -----------------------------------------------------------------------------
 * Implements the AAMVA header rules (DL/ID Card Design Standard, Annex D,
 * header and subfile designator layout).
 *
 * <p>The header is introduced by the file type {@code "ANSI "} and a 6-digit
 * Issuer Identification Number. The compliance indicator and separators that
 * normally precede it ({@code "@\n\u001E\r"}) are not required, because
 * scanners commonly strip or mangle them; instead the file type must start
 * within a bounded leading window of the payload.</p>
 *
 * <p>This class only reads the header. It does not look at data records.</p>
 */
final class AamvaHeaderReader
{
    /** File type marker that opens the issuer header. */
    static final String FILE_TYPE = "ANSI ";

    static final int IIN_LENGTH = 6;

    static final int VERSION_LENGTH = 2;

    static final int ENTRIES_LENGTH = 2;

    /** Subfile type (2) + offset (4) + length (4). */
    static final int DESIGNATOR_LENGTH = 10;

    /** First AAMVA version that carries a jurisdiction version field. */
    static final int FIRST_VERSION_WITH_JURISDICTION = 2;

    private AamvaHeaderReader() {}

    /**
     * Reads the issuer header and returns it with the payload remainder.
     *
     * @param raw    complete, non-empty payload
     * @param window number of leading characters in which the file type must start
     * @return header fields and the text that follows the subfile type
     * @throws HeaderFormatException if the file type or IIN cannot be found
     */
    static AamvaBody read(String raw, int window)
            throws HeaderFormatException
    {
        int pos = locateFileType(raw, window) + FILE_TYPE.length();

        if (!isDigits(raw, pos, IIN_LENGTH)) {
            throw new HeaderFormatException("Missing 6-digit issuer identification number after '" + FILE_TYPE.trim() + "'");
        }
        final String iin = raw.substring(pos, pos + IIN_LENGTH);
        pos += IIN_LENGTH;

        Integer version = readNumber(raw, pos, VERSION_LENGTH);
        if (version != null) {
            pos += VERSION_LENGTH;
        }

        Integer jurisdictionVersion = null;
        if (version != null && version >= FIRST_VERSION_WITH_JURISDICTION) {
            jurisdictionVersion = readNumber(raw, pos, VERSION_LENGTH);
            if (jurisdictionVersion != null) {
                pos += VERSION_LENGTH;
            }
        }

        Integer entries = null;
        if (version != null && (version < FIRST_VERSION_WITH_JURISDICTION || jurisdictionVersion != null)) {
            entries = readNumber(raw, pos, ENTRIES_LENGTH);
            if (entries != null) {
                pos += ENTRIES_LENGTH;
            }
        }

        final List<SubfileDesignator> subfiles = new ArrayList<>();
        final int declared = (entries == null) ? 0 : entries;
        while (subfiles.size() < declared) {
            SubfileDesignator designator = readDesignator(raw, pos);
            if (designator == null) {
                // Header truncated before all declared designators.
                break;
            }
            subfiles.add(designator);
            pos += DESIGNATOR_LENGTH;
        }

        // The data subfile opens with its 2-character type, e.g. "DLDAQ..."
        String subfileType = null;
        if (isSubfileType(raw, pos, subfiles)) {
            subfileType = raw.substring(pos, pos + 2);
            pos += 2;
        }
        else if (!subfiles.isEmpty()) {
            subfileType = subfiles.get(0).type();
        }

        final DocumentType documentType = (subfileType == null)
                ? null
                : DocumentType.fromSubfileType(subfileType).orElse(null);

        final AamvaHeader header = new AamvaHeader(
                iin, version, jurisdictionVersion, entries, subfiles, documentType);

        return new AamvaBody(header, raw.substring(pos));
    }

    /**
     * Returns the index at which {@link #FILE_TYPE} starts.
     *
     * @throws HeaderFormatException if the marker does not start within {@code window}
     */
    static int locateFileType(String raw, int window)
            throws HeaderFormatException
    {
        final int limit = Math.min(window, raw.length() - FILE_TYPE.length() + 1);
        for (int i = 0; i < limit; i++) {
            if (raw.startsWith(FILE_TYPE, i)) {
                return i;
            }
        }
        throw new HeaderFormatException("Missing '" + FILE_TYPE.trim() + "' file type within the first "
                + window + " characters");
    }

    private static SubfileDesignator readDesignator(String raw, int pos) {
        if (!isUpperLetters(raw, pos, 2) || !isDigits(raw, pos + 2, 8)) {
            return null;
        }
        return new SubfileDesignator(
                raw.substring(pos, pos + 2),
                Integer.parseInt(raw.substring(pos + 2, pos + 6)),
                Integer.parseInt(raw.substring(pos + 6, pos + 10)));
    }

    /**
     * The data subfile type is either one of the standard types or the type of
     * the first declared designator.
     */
    private static boolean isSubfileType(String raw, int pos, List<SubfileDesignator> subfiles) {
        if (!isUpperLetters(raw, pos, 2)) {
            return false;
        }
        final String candidate = raw.substring(pos, pos + 2);
        if (DocumentType.fromSubfileType(candidate).isPresent()) {
            return true;
        }
        return !subfiles.isEmpty() && subfiles.get(0).type().equals(candidate);
    }

    private static Integer readNumber(String raw, int pos, int length) {
        return isDigits(raw, pos, length)
                ? Integer.valueOf(raw.substring(pos, pos + length))
                : null;
    }

    private static boolean isDigits(String raw, int pos, int length) {
        if (pos + length > raw.length()) {
            return false;
        }
        for (int i = pos; i < pos + length; i++) {
            final char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isUpperLetters(String raw, int pos, int length) {
        if (pos + length > raw.length()) {
            return false;
        }
        for (int i = pos; i < pos + length; i++) {
            final char c = raw.charAt(i);
            if (c < 'A' || c > 'Z') {
                return false;
            }
        }
        return true;
    }
}
