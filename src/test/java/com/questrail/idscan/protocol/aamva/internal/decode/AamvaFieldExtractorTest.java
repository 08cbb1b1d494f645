package com.questrail.idscan.protocol.aamva.internal.decode;

import com.questrail.idscan.protocol.aamva.config.DateOfBirthPolicy;
import com.questrail.idscan.protocol.aamva.internal.header.AamvaHeader;
import com.questrail.idscan.protocol.aamva.internal.record.ElementId;
import com.questrail.idscan.protocol.aamva.internal.record.RawRecord;
import com.questrail.idscan.protocol.aamva.model.DocumentType;
import com.questrail.idscan.protocol.aamva.model.ParsedIdentity;
import com.questrail.idscan.protocol.aamva.observability.AamvaDecodedEvent;
import com.questrail.idscan.protocol.aamva.observability.AamvaFieldDegradedEvent;
import com.questrail.idscan.protocol.aamva.observability.RecordingAamvaDecodeObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AamvaFieldExtractor}.
 *
 * These tests validate the semantic boundary:
 *   RawRecord sequence -> ParsedIdentity
 */
final class AamvaFieldExtractorTest
{
    private static final AamvaHeader HEADER =
            new AamvaHeader("636045", 9, 0, 2, List.of(), DocumentType.DRIVER_LICENSE);

    private RecordingAamvaDecodeObserver observer;
    private AamvaFieldExtractor strict;
    private AamvaFieldExtractor lenient;

    @BeforeEach
    void setUp()
    {
        observer = new RecordingAamvaDecodeObserver();
        strict = new AamvaFieldExtractor(DateOfBirthPolicy.STRICT, observer);
        lenient = new AamvaFieldExtractor(DateOfBirthPolicy.LENIENT, observer);
    }

    @Test
    void extractsAndNormalizesDirectFields()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME, "JOHNSON"),
                record(ElementId.FIRST_NAME, "JOHN"),
                record(ElementId.MIDDLE_NAME, "MICHAEL"),
                record(ElementId.DATE_OF_BIRTH, "01151990"),
                record(ElementId.STREET_ADDRESS, "123 MAIN ST"),
                record(ElementId.CITY, "SAN FRANCISCO"),
                record(ElementId.JURISDICTION_CODE, "ca"),
                record(ElementId.POSTAL_CODE, "941100000  "),
                record(ElementId.CUSTOMER_ID_NUMBER, " 12345678 "),
                record(ElementId.HEIGHT, "070 IN "),
                record(ElementId.EYE_COLOR, "BRO"),
                record(ElementId.EXPIRATION_DATE, "01152030"),
                record(ElementId.ISSUE_DATE, "20200115")));

        assertEquals("Johnson", identity.lastName());
        assertEquals("John", identity.firstName());
        assertEquals("Michael", identity.middleName());
        assertEquals("1990-01-15", identity.dateOfBirth());
        assertEquals("123 Main St", identity.streetAddress());
        assertEquals("San Francisco", identity.city());
        assertEquals("CA", identity.state());
        assertEquals("941100000", identity.zipCode());
        assertEquals("12345678", identity.licenseNumber());
        assertEquals("070 IN", identity.height());
        assertEquals("BRO", identity.eyeColor());
        assertEquals("2030-01-15", identity.expirationDate());
        assertEquals("2020-01-15", identity.issueDate());
        assertNull(identity.fullName());
    }

    @Test
    void copiesHeaderFields()
    {
        ParsedIdentity identity = strict.extract(HEADER, names("DOE", "JANE"));

        assertEquals(DocumentType.DRIVER_LICENSE, identity.documentType());
        assertEquals("636045", identity.issuerIdentificationNumber());
        assertEquals(9, identity.aamvaVersion());
    }

    @Test
    void lastOccurrenceWins()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME, "SMITH"),
                record(ElementId.FIRST_NAME, "JANE"),
                record(ElementId.FAMILY_NAME, "JONES")));

        assertEquals("Jones", identity.lastName());
    }

    @Test
    void emptyValueIsAbsent()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME, "DOE"),
                record(ElementId.FIRST_NAME, "JANE"),
                record(ElementId.MIDDLE_NAME, "MARIE"),
                record(ElementId.MIDDLE_NAME, "  "),
                record(ElementId.CITY, "")));

        assertNull(identity.middleName());
        assertNull(identity.city());
    }

    @Test
    void fallsBackToAlternateNameElements()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME_ALT, "MCDONALD"),
                record(ElementId.FIRST_NAME_ALT, "RONALD")));

        assertEquals("McDonald", identity.lastName());
        assertEquals("Ronald", identity.firstName());
    }

    @Test
    void derivesNamesFromCompositeElement()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FULL_NAME, "JOHNSON,JOHN,MICHAEL"),
                record(ElementId.DATE_OF_BIRTH, "01011990")));

        assertEquals("Johnson", identity.lastName());
        assertEquals("John", identity.firstName());
        assertEquals("Michael", identity.middleName());
        assertEquals("Johnson,John,Michael", identity.fullName());
    }

    /**
     * Direct elements take precedence per field; the composite only fills the
     * fields that are missing.
     */
    @Test
    void compositeFillsOnlyMissingNameFields()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME, "SMITH"),
                record(ElementId.FULL_NAME, "SMYTHE,JANE,ANN")));

        assertEquals("Smith", identity.lastName());
        assertEquals("Jane", identity.firstName());
        assertEquals("Ann", identity.middleName());
    }

    @Test
    void noDerivableNameIsInvalidFormat()
    {
        AamvaDecodeException e = assertThrows(AamvaDecodeException.class,
                () -> strict.extract(HEADER, List.of(record(ElementId.CUSTOMER_ID_NUMBER, "1"))));
        assertEquals(AamvaError.INVALID_FORMAT, e.error());

        assertThrows(AamvaDecodeException.class, () -> strict.extract(HEADER, List.of()));
    }

    @Test
    void familyNameWithoutGivenNameIsInvalidFormat()
    {
        AamvaDecodeException e = assertThrows(AamvaDecodeException.class,
                () -> strict.extract(HEADER, List.of(record(ElementId.FULL_NAME, "JOHNSON"))));
        assertEquals(AamvaError.INVALID_FORMAT, e.error());
    }

    @Test
    void absentDateOfBirthIsAllowedUnderStrictPolicy()
    {
        ParsedIdentity identity = strict.extract(HEADER, names("DOE", "JANE"));

        assertNull(identity.dateOfBirth());
        assertFalse(observer.hasEventOfType(AamvaFieldDegradedEvent.class));
    }

    @Test
    void unresolvableDateOfBirthFailsUnderStrictPolicy()
    {
        List<RawRecord> records = withDateOfBirth("02301990");

        AamvaDecodeException e = assertThrows(AamvaDecodeException.class, () -> strict.extract(HEADER, records));

        assertEquals(AamvaError.PARSING_FAILED, e.error());
        assertEquals("dateOfBirth", e.field().orElseThrow());
        assertFalse(observer.hasEventOfType(AamvaDecodedEvent.class));
    }

    @Test
    void unresolvableDateOfBirthIsAbsentUnderLenientPolicy()
    {
        ParsedIdentity identity = lenient.extract(HEADER, withDateOfBirth("02301990"));

        assertNull(identity.dateOfBirth());
        List<AamvaFieldDegradedEvent> degraded = observer.getEventsOfType(AamvaFieldDegradedEvent.class);
        assertEquals(1, degraded.size());
        assertEquals(ElementId.DATE_OF_BIRTH, degraded.get(0).element());
    }

    @Test
    void unresolvableDocumentDatesNeverFail()
    {
        ParsedIdentity identity = strict.extract(HEADER, List.of(
                record(ElementId.FAMILY_NAME, "DOE"),
                record(ElementId.FIRST_NAME, "JANE"),
                record(ElementId.EXPIRATION_DATE, "99999999"),
                record(ElementId.ISSUE_DATE, "N/A")));

        assertNull(identity.expirationDate());
        assertNull(identity.issueDate());
        assertEquals(2, observer.getEventsOfType(AamvaFieldDegradedEvent.class).size());
    }

    @Test
    void reportsDecodedRecordCount()
    {
        strict.extract(HEADER, withDateOfBirth("01011990"));

        AamvaDecodedEvent event = observer.getEventsOfType(AamvaDecodedEvent.class).get(0);
        assertEquals(3, event.recordCount());
        assertEquals("636045", event.issuerIdentificationNumber());
        assertEquals(DocumentType.DRIVER_LICENSE, event.documentType());
    }

    private static List<RawRecord> names(String last, String first)
    {
        return List.of(record(ElementId.FAMILY_NAME, last), record(ElementId.FIRST_NAME, first));
    }

    private static List<RawRecord> withDateOfBirth(String dob)
    {
        return List.of(
                record(ElementId.FAMILY_NAME, "DOE"),
                record(ElementId.FIRST_NAME, "JANE"),
                record(ElementId.DATE_OF_BIRTH, dob));
    }

    private static RawRecord record(ElementId id, String value)
    {
        return new RawRecord(id, value);
    }
}
