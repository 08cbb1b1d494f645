/**
 * AAMVA Codec: Header Implementation
 * =============================================================================
 *
 * <p>Concrete header validation for AAMVA DL/ID payloads.</p>
 *
 * <pre>
 *   String payload
 *        → AamvaHeaderReader.locateFileType
 *        → AamvaHeaderReader.read        (IIN, version, entries, designators)
 *        → AamvaBody
 * </pre>
 *
 * <p>Header fields after the IIN are read best-effort: real payloads truncate
 * the header, and a truncated header is still AAMVA data. Only a missing
 * {@code ANSI } marker or IIN rejects the payload.</p>
 */
package com.questrail.idscan.protocol.aamva.codec.impl;
