package com.questrail.idscan.protocol.aamva.model;

import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Identity decoded from an AAMVA DL/ID barcode payload.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code lastName} and {@code firstName} are never blank.</li>
 *   <li>Dates are either {@code null} or canonical {@code YYYY-MM-DD} strings
 *       naming a real calendar date.</li>
 *   <li>Every other component is optional and is {@code null} when the issuer
 *       did not populate the element. Issuer field sets vary by jurisdiction
 *       and document revision, so absence is not an error.</li>
 * </ul>
 *
 * <p>Instances hold personal data. They are not cached, persisted or logged by
 * this library.</p>
 *
 * @param lastName                   family name, mixed case
 * @param firstName                  given name, mixed case
 * @param middleName                 middle name(s), mixed case
 * @param fullName                   composite DAA name as {@code Last,First,Middle}, mixed case
 * @param dateOfBirth                {@code YYYY-MM-DD}
 * @param streetAddress              street line, mixed case
 * @param city                       city, mixed case
 * @param state                      2-letter jurisdiction code, upper case
 * @param zipCode                    postal code without padding
 * @param licenseNumber              customer ID number (DAQ)
 * @param height                     height as encoded by the issuer, e.g. {@code 070 IN}
 * @param eyeColor                   eye color code, e.g. {@code BRO}
 * @param expirationDate             document expiration, {@code YYYY-MM-DD}
 * @param issueDate                  document issue date, {@code YYYY-MM-DD}
 * @param documentType               subfile type from the header
 * @param issuerIdentificationNumber 6-digit IIN from the header
 * @param aamvaVersion               AAMVA version number from the header
 */
public record ParsedIdentity(
        String lastName,
        String firstName,
        String middleName,
        String fullName,
        String dateOfBirth,
        String streetAddress,
        String city,
        String state,
        String zipCode,
        String licenseNumber,
        String height,
        String eyeColor,
        String expirationDate,
        String issueDate,
        DocumentType documentType,
        String issuerIdentificationNumber,
        Integer aamvaVersion
)
{
    public ParsedIdentity {
        requireName(lastName, "lastName");
        requireName(firstName, "firstName");
        requireCanonicalDate(dateOfBirth, "dateOfBirth");
        requireCanonicalDate(expirationDate, "expirationDate");
        requireCanonicalDate(issueDate, "issueDate");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Name for display, {@code "First Last"}.
     */
    public String displayName() {
        return firstName + " " + lastName;
    }

    /**
     * Name for display including the middle name when present.
     */
    public String fullDisplayName() {
        return (middleName == null)
                ? displayName()
                : firstName + " " + middleName + " " + lastName;
    }

    /**
     * Address as two lines, {@code street} and {@code city, state, zip}, with
     * absent parts left out.
     *
     * @return the address, or empty if no address element is present
     */
    public Optional<String> formattedAddress() {
        final List<String> lines = new ArrayList<>(2);
        if (streetAddress != null) {
            lines.add(streetAddress);
        }

        final List<String> cityStateZip = new ArrayList<>(3);
        if (city != null) cityStateZip.add(city);
        if (state != null) cityStateZip.add(state);
        if (zipCode != null) cityStateZip.add(zipCode);
        if (!cityStateZip.isEmpty()) {
            lines.add(String.join(", ", cityStateZip));
        }

        return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", lines));
    }

    public Optional<LocalDate> dateOfBirthAsLocalDate() {
        return Optional.ofNullable(dateOfBirth).map(LocalDate::parse);
    }

    public Optional<LocalDate> expirationDateAsLocalDate() {
        return Optional.ofNullable(expirationDate).map(LocalDate::parse);
    }

    /**
     * Completed years of age on the given day.
     *
     * <p>This is a calculation only. Whether the holder is old enough for a
     * purchase is decided by the caller.</p>
     *
     * @param asOf day to compute the age on
     * @return age in years, or empty if the date of birth is absent or after {@code asOf}
     */
    public OptionalInt ageOn(LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        final Optional<LocalDate> dob = dateOfBirthAsLocalDate();
        if (dob.isEmpty() || dob.get().isAfter(asOf)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Period.between(dob.get(), asOf).getYears());
    }

    /**
     * Validity of the document on the given day, from its expiration date.
     */
    public LicenseStatus licenseStatusOn(LocalDate asOf) {
        return LicenseStatus.evaluate(expirationDateAsLocalDate().orElse(null), asOf);
    }

    private static void requireName(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requireCanonicalDate(String value, String name) {
        if (value == null) {
            return;
        }
        try {
            LocalDate.parse(value);
        }
        catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be YYYY-MM-DD (was '" + value + "')", e);
        }
    }

    /**
     * Mutable builder used by the field extractor and by tests.
     */
    public static final class Builder {
        private String lastName;
        private String firstName;
        private String middleName;
        private String fullName;
        private String dateOfBirth;
        private String streetAddress;
        private String city;
        private String state;
        private String zipCode;
        private String licenseNumber;
        private String height;
        private String eyeColor;
        private String expirationDate;
        private String issueDate;
        private DocumentType documentType;
        private String issuerIdentificationNumber;
        private Integer aamvaVersion;

        private Builder() {}

        public Builder withLastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder withFirstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder withMiddleName(String middleName) {
            this.middleName = middleName;
            return this;
        }

        public Builder withFullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder withDateOfBirth(String dateOfBirth) {
            this.dateOfBirth = dateOfBirth;
            return this;
        }

        public Builder withStreetAddress(String streetAddress) {
            this.streetAddress = streetAddress;
            return this;
        }

        public Builder withCity(String city) {
            this.city = city;
            return this;
        }

        public Builder withState(String state) {
            this.state = state;
            return this;
        }

        public Builder withZipCode(String zipCode) {
            this.zipCode = zipCode;
            return this;
        }

        public Builder withLicenseNumber(String licenseNumber) {
            this.licenseNumber = licenseNumber;
            return this;
        }

        public Builder withHeight(String height) {
            this.height = height;
            return this;
        }

        public Builder withEyeColor(String eyeColor) {
            this.eyeColor = eyeColor;
            return this;
        }

        public Builder withExpirationDate(String expirationDate) {
            this.expirationDate = expirationDate;
            return this;
        }

        public Builder withIssueDate(String issueDate) {
            this.issueDate = issueDate;
            return this;
        }

        public Builder withDocumentType(DocumentType documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder withIssuerIdentificationNumber(String issuerIdentificationNumber) {
            this.issuerIdentificationNumber = issuerIdentificationNumber;
            return this;
        }

        public Builder withAamvaVersion(Integer aamvaVersion) {
            this.aamvaVersion = aamvaVersion;
            return this;
        }

        public ParsedIdentity build() {
            return new ParsedIdentity(
                    lastName, firstName, middleName, fullName, dateOfBirth,
                    streetAddress, city, state, zipCode, licenseNumber,
                    height, eyeColor, expirationDate, issueDate,
                    documentType, issuerIdentificationNumber, aamvaVersion);
        }
    }
}
