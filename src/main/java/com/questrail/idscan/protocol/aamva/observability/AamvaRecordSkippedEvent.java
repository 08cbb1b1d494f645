package com.questrail.idscan.protocol.aamva.observability;

/**
 * Record describing a body segment the tokenizer did not turn into a data
 * record.
 *
 * <p>{@code prefix} holds at most the first three characters of the segment,
 * never its value.</p>
 */
public record AamvaRecordSkippedEvent(
    int offset,
    String prefix,
    Reason reason
) {
    public enum Reason {
        /** Segment shorter than an element identifier. */
        TOO_SHORT,
        /** Segment prefix is not a recognized element identifier. */
        UNRECOGNIZED_ELEMENT
    }
}
