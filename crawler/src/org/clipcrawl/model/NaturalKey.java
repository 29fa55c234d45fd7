package org.clipcrawl.model;

import java.util.Objects;

/**
 * The portal's own identifier for an entity, qualified by kind.
 */
public record NaturalKey(EntityKind kind, String value) {
    public NaturalKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("blank natural key for " + kind);
    }

    public static NaturalKey of(EntityKind kind, Object... parts) {
        var sb = new StringBuilder();
        for (Object part : parts) {
            sb.append(part);
        }
        return new NaturalKey(kind, sb.toString());
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
