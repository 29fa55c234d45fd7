package org.clipcrawl.model;

import java.time.Instant;

/**
 * A field's current value and where it came from.
 *
 * @param value         a String, Integer or Boolean
 * @param observedAt    fetch time of the page the value was read from
 * @param source        page kind the value was read from
 * @param authoritative whether that page is authoritative for the field
 */
public record FieldValue(Object value, Instant observedAt, String source, boolean authoritative) {
}
