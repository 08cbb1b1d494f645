package com.questrail.idscan.protocol.aamva.internal.record;

import java.util.Objects;

/**
 * A single data record as cut from the payload body: a recognized element ID
 * and its untrimmed value (possibly empty, never null).
 *
 * Instances are transient; they are consumed by the field extractor and never
 * escape the decode pipeline.
 */
public record RawRecord(ElementId elementId, String value)
{
    public RawRecord {
        Objects.requireNonNull(elementId, "elementId");
        Objects.requireNonNull(value, "value");
    }
}
