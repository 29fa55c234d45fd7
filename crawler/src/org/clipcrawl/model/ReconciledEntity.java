package org.clipcrawl.model;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The merged state of an entity, as written to the store.
 *
 * @param id         surrogate identifier
 * @param kind       entity kind
 * @param naturalKey the portal's key
 * @param fields     merged fields with provenance
 * @param references fields that point at other entities by natural key
 * @param updatedAt  fetch time of the latest observation that changed this entity
 */
public record ReconciledEntity(
        UUID id,
        EntityKind kind,
        String naturalKey,
        FieldSet fields,
        Map<String, NaturalKey> references,
        @Nullable Instant updatedAt) {

    public ReconciledEntity {
        references = Map.copyOf(references);
    }

    public static ReconciledEntity empty(SurrogateIdentity identity) {
        return new ReconciledEntity(identity.id(), identity.kind(), identity.naturalKey(), FieldSet.empty(),
                Map.of(), null);
    }

    public @Nullable Object value(String field) {
        return fields.value(field);
    }

    /**
     * Display name used for free text lookup.
     */
    public @Nullable String name() {
        Object name = fields.value("name");
        return name == null ? null : name.toString();
    }
}
