package com.questrail.idscan.protocol.aamva.internal.record;

import com.questrail.idscan.protocol.aamva.observability.AamvaDecodeObserver;
import com.questrail.idscan.protocol.aamva.observability.AamvaRecordSkippedEvent;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * AamvaRecordTokenizer
 * -----------------------------------------------------------------------------
 * Splits the body of an AAMVA payload into {@link RawRecord}s.
 *
 * <p>Record boundaries are the segment terminator (carriage return,
 * {@code \r}) and the data element separator (line feed, {@code \n}). Issuers
 * disagree on which of the two ends a data record, so both are accepted.</p>
 *
 * <p>For every non-empty segment:</p>
 * <ul>
 *   <li>The first three characters are the element ID.</li>
 *   <li>Everything up to the next separator is the raw value.</li>
 * </ul>
 *
 * <p>Segments shorter than an element ID, or whose prefix is not an
 * {@link ElementId}, are skipped. This absorbs repeated subfile designators,
 * trailing terminators and vendor padding records without failing the
 * payload. Skips are reported to the {@link AamvaDecodeObserver} only.</p>
 *
 * <p>The scan walks character positions directly; no regular expressions
 * are involved.</p>
 */
public final class AamvaRecordTokenizer
{
    static final char SEGMENT_TERMINATOR = '\r';
    static final char DATA_ELEMENT_SEPARATOR = '\n';

    private final AamvaDecodeObserver observer;

    public AamvaRecordTokenizer(AamvaDecodeObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Returns the records contained in {@code body}.
     *
     * <p>The returned {@link Iterable} is lazy and restartable: every call to
     * {@link Iterable#iterator()} starts a fresh scan from the first character
     * and yields the same sequence.</p>
     *
     * @param body payload remainder after the header
     * @return records in payload order
     */
    public Iterable<RawRecord> tokenize(String body) {
        Objects.requireNonNull(body, "body");
        return () -> new Scan(body);
    }

    static boolean isSeparator(char c) {
        return c == SEGMENT_TERMINATOR || c == DATA_ELEMENT_SEPARATOR;
    }

    private final class Scan implements Iterator<RawRecord>
    {
        private final String body;
        private int position;
        private RawRecord next;

        private Scan(String body) {
            this.body = body;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public RawRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawRecord record = next;
            next = null;
            return record;
        }

        private RawRecord advance() {
            while (position < body.length()) {
                final int start = position;
                int end = start;
                while (end < body.length() && !isSeparator(body.charAt(end))) {
                    end++;
                }
                // Step over the separator (if any) for the next segment.
                position = end + 1;

                if (end == start) {
                    continue;
                }

                if (end - start < ElementId.CODE_LENGTH) {
                    observer.onRecordSkipped(new AamvaRecordSkippedEvent(
                            start,
                            body.substring(start, end),
                            AamvaRecordSkippedEvent.Reason.TOO_SHORT));
                    continue;
                }

                final String code = body.substring(start, start + ElementId.CODE_LENGTH);
                Optional<ElementId> element = ElementId.fromCode(code);
                if (element.isEmpty()) {
                    observer.onRecordSkipped(new AamvaRecordSkippedEvent(
                            start,
                            code,
                            AamvaRecordSkippedEvent.Reason.UNRECOGNIZED_ELEMENT));
                    continue;
                }

                return new RawRecord(element.get(), body.substring(start + ElementId.CODE_LENGTH, end));
            }
            return null;
        }
    }
}
