package org.clipcrawl.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable map of field name to value with provenance.
 */
public final class FieldSet {
    private static final FieldSet EMPTY = new FieldSet(Map.of());
    private final Map<String, FieldValue> fields;

    @JsonCreator
    public FieldSet(Map<String, FieldValue> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static FieldSet empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, FieldValue> asMap() {
        return fields;
    }

    public @Nullable FieldValue get(String name) {
        return fields.get(name);
    }

    public @Nullable Object value(String name) {
        FieldValue field = fields.get(name);
        return field == null ? null : field.value();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /**
     * Values without provenance, for display and comparison.
     */
    public Map<String, Object> values() {
        var values = new LinkedHashMap<String, Object>();
        fields.forEach((name, field) -> values.put(name, field.value()));
        return values;
    }

    public FieldSet with(Map<String, FieldValue> changes) {
        if (changes.isEmpty()) return this;
        var merged = new LinkedHashMap<>(fields);
        merged.putAll(changes);
        return new FieldSet(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof FieldSet other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return values().toString();
    }
}
