package org.clipcrawl.model;

import java.util.UUID;

/**
 * Audit record of a non-null field value being replaced, or of a stale observation losing to a newer
 * one.
 *
 * @param entityId  the entity
 * @param field     field name
 * @param kept      the value the entity holds after the merge
 * @param discarded the value that lost
 * @param superseded true when the previously stored value was replaced, false when the incoming value
 *                   was rejected
 */
public record MergeConflict(UUID entityId, String field, FieldValue kept, FieldValue discarded, boolean superseded) {
}
