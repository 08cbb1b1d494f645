package com.questrail.idscan.protocol.aamva.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Validity of an identity document on a given day, derived from its
 * expiration date (DBA).
 *
 * <ul>
 *   <li>{@link Valid}: expires more than {@value #EXPIRING_SOON_DAYS} days out</li>
 *   <li>{@link ExpiringSoon}: expires within {@value #EXPIRING_SOON_DAYS} days,
 *       today included</li>
 *   <li>{@link Expired}: expiration date is in the past</li>
 *   <li>{@link Unknown}: no usable expiration date</li>
 * </ul>
 */
public sealed interface LicenseStatus
        permits LicenseStatus.Valid, LicenseStatus.ExpiringSoon, LicenseStatus.Expired, LicenseStatus.Unknown
{
    int EXPIRING_SOON_DAYS = 30;

    /**
     * Whether a document in this state may be accepted as identification.
     */
    boolean isAcceptable();

    record Valid() implements LicenseStatus {
        @Override
        public boolean isAcceptable() {
            return true;
        }
    }

    record ExpiringSoon(long daysRemaining) implements LicenseStatus {
        @Override
        public boolean isAcceptable() {
            return true;
        }
    }

    record Expired(LocalDate expiredOn) implements LicenseStatus {
        public Expired {
            Objects.requireNonNull(expiredOn, "expiredOn");
        }

        @Override
        public boolean isAcceptable() {
            return false;
        }
    }

    record Unknown() implements LicenseStatus {
        @Override
        public boolean isAcceptable() {
            return false;
        }
    }

    /**
     * @param expiration expiration date, or {@code null} if unknown
     * @param asOf       day to evaluate on
     */
    static LicenseStatus evaluate(LocalDate expiration, LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        if (expiration == null) {
            return new Unknown();
        }
        if (expiration.isBefore(asOf)) {
            return new Expired(expiration);
        }
        final long days = ChronoUnit.DAYS.between(asOf, expiration);
        return (days <= EXPIRING_SOON_DAYS) ? new ExpiringSoon(days) : new Valid();
    }
}
