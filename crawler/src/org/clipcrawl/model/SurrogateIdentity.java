package org.clipcrawl.model;

import java.util.UUID;

/**
 * Stable internal identifier allocated the first time a natural key is seen. Never reassigned.
 */
public record SurrogateIdentity(UUID id, EntityKind kind, String naturalKey) {
    public NaturalKey key() {
        return new NaturalKey(kind, naturalKey);
    }
}
