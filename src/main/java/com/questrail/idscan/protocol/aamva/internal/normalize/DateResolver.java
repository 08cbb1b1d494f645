package com.questrail.idscan.protocol.aamva.internal.normalize;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * DateResolver
 * -----------------------------------------------------------------------------
 * Resolves AAMVA 8-digit date fields (DBB, DBA, DBD) to canonical
 * {@code YYYY-MM-DD}.
 *
 * <p>The standard leaves the layout issuer-dependent: US jurisdictions use
 * {@code MMDDCCYY}, Canadian jurisdictions {@code CCYYMMDD}. Layouts are tried
 * in that order and the first one that yields a real calendar date wins:</p>
 * <ol>
 *   <li>{@code MMDDCCYY}: month 1 to 12, day within the month</li>
 *   <li>{@code CCYYMMDD}: same validation</li>
 * </ol>
 *
 * <p>Non-digit characters are discarded before the layouts are tried
 * ({@code 01/15/1990} resolves like {@code 01151990}).</p>
 */
public final class DateResolver
{
    static final int DATE_DIGITS = 8;

    private DateResolver() {}

    /**
     * @param raw date field value as read from the payload; may be {@code null}
     * @return the date as {@code YYYY-MM-DD}, or empty if neither layout yields
     *         a valid calendar date
     */
    public static Optional<String> resolve(String raw) {
        return resolveDate(raw).map(DateTimeFormatter.ISO_LOCAL_DATE::format);
    }

    /**
     * Same as {@link #resolve(String)} but returns the {@link LocalDate}.
     */
    public static Optional<LocalDate> resolveDate(String raw) {
        if (raw == null) {
            return Optional.empty();
        }

        final String digits = digitsOf(raw);
        if (digits.length() != DATE_DIGITS) {
            return Optional.empty();
        }

        // MMDDCCYY
        Optional<LocalDate> monthFirst = toDate(
                number(digits, 4, 8),
                number(digits, 0, 2),
                number(digits, 2, 4));
        if (monthFirst.isPresent()) {
            return monthFirst;
        }

        // CCYYMMDD
        return toDate(
                number(digits, 0, 4),
                number(digits, 4, 6),
                number(digits, 6, 8));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        if (year < 1 || month < 1 || month > 12 || day < 1) {
            return Optional.empty();
        }
        final YearMonth yearMonth = YearMonth.of(year, month);
        if (!yearMonth.isValidDay(day)) {
            return Optional.empty();
        }
        return Optional.of(yearMonth.atDay(day));
    }

    private static int number(String digits, int from, int to) {
        return Integer.parseInt(digits.substring(from, to));
    }

    private static String digitsOf(String raw) {
        final StringBuilder digits = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }
}
