package com.questrail.idscan.protocol.aamva.internal.decode;

import com.questrail.idscan.protocol.aamva.config.DateOfBirthPolicy;
import com.questrail.idscan.protocol.aamva.internal.header.AamvaHeader;
import com.questrail.idscan.protocol.aamva.internal.normalize.AddressCaser;
import com.questrail.idscan.protocol.aamva.internal.normalize.DateResolver;
import com.questrail.idscan.protocol.aamva.internal.normalize.FullNameSplitter;
import com.questrail.idscan.protocol.aamva.internal.normalize.NameCaser;
import com.questrail.idscan.protocol.aamva.internal.normalize.SplitName;
import com.questrail.idscan.protocol.aamva.internal.normalize.ZipTrimmer;
import com.questrail.idscan.protocol.aamva.internal.record.ElementId;
import com.questrail.idscan.protocol.aamva.internal.record.RawRecord;
import com.questrail.idscan.protocol.aamva.model.ParsedIdentity;
import com.questrail.idscan.protocol.aamva.observability.AamvaDecodeObserver;
import com.questrail.idscan.protocol.aamva.observability.AamvaDecodedEvent;
import com.questrail.idscan.protocol.aamva.observability.AamvaFieldDegradedEvent;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * AamvaFieldExtractor
 * ============================================================================
 * Converts the data records of one payload into a {@link ParsedIdentity}.
 *
 * <h2>Resolution rules</h2>
 * <ul>
 *   <li>If an element repeats, its last occurrence wins.</li>
 *   <li>Values are trimmed; an empty value counts as absent.</li>
 *   <li>Family name: DCS, then DAB, then the first DAA segment.</li>
 *   <li>Given name: DAC, then DCT, then the second DAA segment.</li>
 *   <li>Middle name: DAD, then the DAA middle segment.</li>
 *   <li>Dates (DBB, DBA, DBD) go through {@link DateResolver}.</li>
 *   <li>Every other element is optional and defaults to absent.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>No derivable family <em>and</em> given name →
 *       {@link AamvaError#INVALID_FORMAT}</li>
 *   <li>DBB present but unresolvable under {@link DateOfBirthPolicy#STRICT} →
 *       {@link AamvaError#PARSING_FAILED}</li>
 * </ul>
 *
 * Nothing else fails extraction. Unresolvable optional dates are reported to
 * the observer and left absent.
 */
public final class AamvaFieldExtractor
{
    static final String DATE_OF_BIRTH_FIELD = "dateOfBirth";

    private final DateOfBirthPolicy dateOfBirthPolicy;
    private final AamvaDecodeObserver observer;

    public AamvaFieldExtractor(DateOfBirthPolicy dateOfBirthPolicy, AamvaDecodeObserver observer) {
        this.dateOfBirthPolicy = Objects.requireNonNull(dateOfBirthPolicy, "dateOfBirthPolicy");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Builds the identity for one payload.
     *
     * @param header  issuer header of the payload
     * @param records data records in payload order; consumed once
     * @return the decoded identity
     * @throws AamvaDecodeException if no name can be derived, or the date of
     *         birth is unresolvable under the strict policy
     */
    public ParsedIdentity extract(AamvaHeader header, Iterable<RawRecord> records) {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(records, "records");

        final Map<ElementId, String> raw = new EnumMap<>(ElementId.class);
        int recordCount = 0;
        for (RawRecord record : records) {
            recordCount++;
            final String value = record.value().strip();
            if (value.isEmpty()) {
                // A later empty occurrence still replaces an earlier value.
                raw.remove(record.elementId());
            } else {
                raw.put(record.elementId(), value);
            }
        }

        final Map<ElementId, String> fields = new EnumMap<>(ElementId.class);
        for (Map.Entry<ElementId, String> entry : raw.entrySet()) {
            final String normalized = normalize(entry.getKey(), entry.getValue());
            if (normalized != null && !normalized.isEmpty()) {
                fields.put(entry.getKey(), normalized);
            }
        }

        final Optional<SplitName> composite = FullNameSplitter.split(fields.get(ElementId.FULL_NAME));

        final String lastName = firstPresent(
                fields.get(ElementId.FAMILY_NAME),
                fields.get(ElementId.FAMILY_NAME_ALT),
                composite.map(SplitName::last).orElse(null));
        final String firstName = firstPresent(
                fields.get(ElementId.FIRST_NAME),
                fields.get(ElementId.FIRST_NAME_ALT),
                composite.flatMap(SplitName::firstName).orElse(null));
        final String middleName = firstPresent(
                fields.get(ElementId.MIDDLE_NAME),
                composite.flatMap(SplitName::middleName).orElse(null));

        if (lastName == null || firstName == null) {
            throw new AamvaDecodeException(AamvaError.INVALID_FORMAT,
                    "no family and given name can be derived from DCS/DAB, DAC/DCT or DAA");
        }

        if (raw.containsKey(ElementId.DATE_OF_BIRTH)
                && !fields.containsKey(ElementId.DATE_OF_BIRTH)
                && dateOfBirthPolicy == DateOfBirthPolicy.STRICT) {
            throw new AamvaDecodeException(AamvaError.PARSING_FAILED, DATE_OF_BIRTH_FIELD,
                    "DBB is neither MMDDCCYY nor CCYYMMDD");
        }

        final ParsedIdentity identity = ParsedIdentity.builder()
                .withLastName(lastName)
                .withFirstName(firstName)
                .withMiddleName(middleName)
                .withFullName(composite.map(AamvaFieldExtractor::joinComposite).orElse(null))
                .withDateOfBirth(fields.get(ElementId.DATE_OF_BIRTH))
                .withStreetAddress(fields.get(ElementId.STREET_ADDRESS))
                .withCity(fields.get(ElementId.CITY))
                .withState(fields.get(ElementId.JURISDICTION_CODE))
                .withZipCode(fields.get(ElementId.POSTAL_CODE))
                .withLicenseNumber(fields.get(ElementId.CUSTOMER_ID_NUMBER))
                .withHeight(fields.get(ElementId.HEIGHT))
                .withEyeColor(fields.get(ElementId.EYE_COLOR))
                .withExpirationDate(fields.get(ElementId.EXPIRATION_DATE))
                .withIssueDate(fields.get(ElementId.ISSUE_DATE))
                .withDocumentType(header.documentType())
                .withIssuerIdentificationNumber(header.issuerIdentificationNumber())
                .withAamvaVersion(header.version())
                .build();

        observer.onDecoded(new AamvaDecodedEvent(
                header.issuerIdentificationNumber(),
                header.documentType(),
                recordCount));

        return identity;
    }

    /**
     * Applies the per-element normalizer to a trimmed, non-empty value.
     *
     * @return the normalized value, or {@code null} if it cannot be resolved
     */
    private String normalize(ElementId element, String value) {
        return switch (element) {
            case FAMILY_NAME, FAMILY_NAME_ALT, FIRST_NAME, FIRST_NAME_ALT, MIDDLE_NAME ->
                    NameCaser.normalize(value);

            // Split later, once the direct name elements are known.
            case FULL_NAME -> value;

            case DATE_OF_BIRTH, EXPIRATION_DATE, ISSUE_DATE -> resolveDate(element, value);

            case STREET_ADDRESS -> AddressCaser.normalizeStreet(value);
            case CITY -> AddressCaser.normalizeCity(value);
            case JURISDICTION_CODE -> value.toUpperCase(Locale.ROOT);
            case POSTAL_CODE -> ZipTrimmer.normalize(value);

            case CUSTOMER_ID_NUMBER, HEIGHT, EYE_COLOR -> value;
        };
    }

    private String resolveDate(ElementId element, String value) {
        final Optional<String> resolved = DateResolver.resolve(value);
        if (resolved.isEmpty()) {
            observer.onFieldDegraded(new AamvaFieldDegradedEvent(
                    element, "neither MMDDCCYY nor CCYYMMDD yields a calendar date"));
        }
        return resolved.orElse(null);
    }

    private static String joinComposite(SplitName name) {
        final StringBuilder joined = new StringBuilder(name.last());
        if (name.first() != null || name.middle() != null) {
            joined.append(',').append(name.first() == null ? "" : name.first());
        }
        if (name.middle() != null) {
            joined.append(',').append(name.middle());
        }
        return joined.toString();
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
