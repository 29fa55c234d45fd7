package org.clipcrawl.db;

import org.clipcrawl.model.EntityKind;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;

/**
 * A field of one entity pointing at another by natural key. {@code targetId} stays null until the
 * target has been committed.
 */
public record EntityReference(UUID entityId, String field, EntityKind targetKind, String targetKey,
                              @Nullable UUID targetId) {
    public boolean resolved() {
        return targetId != null;
    }
}
