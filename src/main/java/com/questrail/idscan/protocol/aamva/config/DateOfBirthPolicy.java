package com.questrail.idscan.protocol.aamva.config;

/**
 * What the decoder does when a date-of-birth element (DBB) is present but
 * resolves to no valid calendar date in either supported layout.
 *
 * <p>A payload without any DBB element decodes under both policies, with the
 * date of birth absent.</p>
 */
public enum DateOfBirthPolicy
{
    /** Reject the payload with {@code PARSING_FAILED}. */
    STRICT,

    /** Decode the payload and leave the date of birth absent. */
    LENIENT
}
