package com.questrail.idscan.protocol.aamva.codec.impl;

import com.questrail.idscan.protocol.aamva.codec.AamvaBody;
import com.questrail.idscan.protocol.aamva.internal.header.AamvaHeader;
import com.questrail.idscan.protocol.aamva.internal.header.SubfileDesignator;
import com.questrail.idscan.protocol.aamva.model.DocumentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AamvaHeaderReaderTest
{
    private static final String PREAMBLE = "@\n\u001E\r";
    private static final int WINDOW = 64;

    // ---------------------------------------------------------------------
    // Complete headers
    // ---------------------------------------------------------------------

    /**
     * Verifies that a full version 9 header yields the IIN, version,
     * jurisdiction version, entry count and both designators, and that the
     * "DL" subfile type opening the data is removed from the body.
     */
    @Test
    void readsCompleteVersionNineHeader() throws HeaderFormatException
    {
        String raw = PREAMBLE + "ANSI 636045090002DL00410278ZC03200024DL\rDCSJOHNSON\r";

        AamvaBody body = AamvaHeaderReader.read(raw, WINDOW);
        AamvaHeader header = body.header();

        assertEquals("636045", header.issuerIdentificationNumber());
        assertEquals(9, header.version());
        assertEquals(0, header.jurisdictionVersion());
        assertEquals(2, header.numberOfEntries());
        assertEquals(List.of(
                new SubfileDesignator("DL", 41, 278),
                new SubfileDesignator("ZC", 320, 24)), header.subfiles());
        assertEquals(DocumentType.DRIVER_LICENSE, header.documentType());
        assertEquals("\rDCSJOHNSON\r", body.records());
    }

    /**
     * Verifies the common layout where the first data element follows the
     * subfile type on the same line ("DLDAQ...").
     */
    @Test
    void stripsSubfileTypeDirectlyFollowedByElement() throws HeaderFormatException
    {
        String raw = PREAMBLE + "ANSI 636014090102DL00410288ZC03290015DLDAQD1234562\nDCSSAMPLE\n";

        AamvaBody body = AamvaHeaderReader.read(raw, WINDOW);

        assertEquals(1, body.header().jurisdictionVersion());
        assertEquals("DAQD1234562\nDCSSAMPLE\n", body.records());
    }

    /**
     * Version 1 headers carry no jurisdiction version field; the two digits
     * after the version are the entry count.
     */
    @Test
    void readsVersionOneHeaderWithoutJurisdictionVersion() throws HeaderFormatException
    {
        String raw = PREAMBLE + "ANSI 6360000101DL00290200DLDAQ123\n";

        AamvaHeader header = AamvaHeaderReader.read(raw, WINDOW).header();

        assertEquals(1, header.version());
        assertNull(header.jurisdictionVersion());
        assertEquals(1, header.numberOfEntries());
        assertEquals(List.of(new SubfileDesignator("DL", 29, 200)), header.subfiles());
    }

    @Test
    void mapsIdSubfileToIdentificationCard() throws HeaderFormatException
    {
        String raw = PREAMBLE + "ANSI 636014080101ID00410200IDDAQ1\n";

        AamvaBody body = AamvaHeaderReader.read(raw, WINDOW);

        assertEquals(DocumentType.IDENTIFICATION_CARD, body.header().documentType());
        assertEquals("DAQ1\n", body.records());
    }

    /**
     * A jurisdiction-specific subfile type is stripped when it matches the
     * first designator, but has no document type.
     */
    @Test
    void jurisdictionSubfileHasNoDocumentType() throws HeaderFormatException
    {
        String raw = "ANSI 636000090001ZA00310010ZADAQ1\n";

        AamvaBody body = AamvaHeaderReader.read(raw, WINDOW);

        assertNull(body.header().documentType());
        assertEquals("DAQ1\n", body.records());
    }

    // ---------------------------------------------------------------------
    // Truncated headers
    // ---------------------------------------------------------------------

    /**
     * Verifies that a header declaring two entries but carrying none still
     * validates; the subfile type is recognized and removed.
     */
    @Test
    void toleratesMissingDesignators() throws HeaderFormatException
    {
        String raw = PREAMBLE + "ANSI 636045090002DL\rDCSDOE\r";

        AamvaBody body = AamvaHeaderReader.read(raw, WINDOW);

        assertEquals(2, body.header().numberOfEntries());
        assertTrue(body.header().subfiles().isEmpty());
        assertEquals(DocumentType.DRIVER_LICENSE, body.header().documentType());
        assertEquals("\rDCSDOE\r", body.records());
    }

    @Test
    void toleratesHeaderEndingAfterIin() throws HeaderFormatException
    {
        AamvaBody body = AamvaHeaderReader.read("ANSI 636045", WINDOW);

        assertEquals("636045", body.header().issuerIdentificationNumber());
        assertNull(body.header().version());
        assertNull(body.header().documentType());
        assertEquals("", body.records());
    }

    /**
     * Verifies that a header without the compliance preamble is accepted as
     * long as the file type starts inside the window.
     */
    @Test
    void acceptsMissingPreamble() throws HeaderFormatException
    {
        AamvaBody body = AamvaHeaderReader.read("ANSI 636045090002DL\rDCSDOE\r", WINDOW);
        assertEquals("636045", body.header().issuerIdentificationNumber());
    }

    // ---------------------------------------------------------------------
    // Rejection
    // ---------------------------------------------------------------------

    @Test
    void rejectsPayloadWithoutFileType()
    {
        assertThrows(HeaderFormatException.class,
                () -> AamvaHeaderReader.read("this is not a barcode", WINDOW));
    }

    /**
     * The file type must be followed by exactly six digits.
     */
    @Test
    void rejectsNonNumericIin()
    {
        assertThrows(HeaderFormatException.class,
                () -> AamvaHeaderReader.read(PREAMBLE + "ANSI 63A045090002DL\r", WINDOW));
        assertThrows(HeaderFormatException.class,
                () -> AamvaHeaderReader.read(PREAMBLE + "ANSI 63604", WINDOW));
    }

    /**
     * Verifies that a file type starting beyond the leading window is not
     * found, while a wider window accepts the same payload.
     */
    @Test
    void fileTypeMustStartWithinWindow() throws HeaderFormatException
    {
        String raw = "x".repeat(80) + "ANSI 636045090002DL\rDCSDOE\r";

        assertThrows(HeaderFormatException.class, () -> AamvaHeaderReader.locateFileType(raw, WINDOW));
        assertEquals(80, AamvaHeaderReader.locateFileType(raw, 128));
    }

    /**
     * The window bounds where the file type starts, not where the header
     * ends: a window of one accepts a header at index 0 only.
     */
    @Test
    void windowOfOneAcceptsFileTypeAtStartOnly() throws HeaderFormatException
    {
        AamvaBody body = AamvaHeaderReader.read("ANSI 636045090002DL\rDCSDOE\r", 1);
        assertEquals("636045", body.header().issuerIdentificationNumber());

        assertThrows(HeaderFormatException.class,
                () -> AamvaHeaderReader.locateFileType("xANSI 636045", 1));
    }

    @Test
    void rejectsPayloadShorterThanFileType()
    {
        assertThrows(HeaderFormatException.class, () -> AamvaHeaderReader.locateFileType("ANS", WINDOW));
    }
}
