/**
 * AAMVA Codec: Header Stage
 * =============================================================================
 *
 * <p>This package defines the <strong>header boundary</strong> of the AAMVA
 * DL/ID decoder: the step that decides whether a raw string recovered from a
 * PDF-417 symbol is AAMVA data at all.</p>
 *
 * <h2>Normative Authority</h2>
 * <p>The AAMVA DL/ID Card Design Standard defines the payload layout:</p>
 * <pre>
 *   "@" LF RS CR                       compliance indicator and separators
 *   "ANSI " IIN(6) version(2)          file type and issuer header
 *   [jurisdiction version(2)] entries(2)
 *   { type(2) offset(4) length(4) }    subfile designators
 *   "DL" | "ID"                         subfile type
 *   { elementId(3) value CR|LF }        data records
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String payload
 *        → AamvaHeaderValidator   (header rules applied here)
 *            → AamvaBody          (header fields + record text)
 *                → AamvaRecordTokenizer
 *                    → AamvaFieldExtractor
 *                        → ParsedIdentity
 * </pre>
 *
 * <p>Header failures are permanent for the payload. Everything after this
 * stage degrades gracefully instead of failing.</p>
 */
package com.questrail.idscan.protocol.aamva.codec;
