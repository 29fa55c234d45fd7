package org.clipcrawl.model;

import org.clipcrawl.portal.PageKind;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A partial view of one entity as read from one page. Fields the page didn't show are absent rather
 * than null. Immutable.
 */
public final class StructuredRecord {
    /**
     * Earliest and latest academic year an entity was seen in. Merged by widening the range.
     */
    public static final String FIRST_YEAR = "first_year";
    public static final String LAST_YEAR = "last_year";

    private final NaturalKey key;
    private final Map<String, Object> fields;
    private final Map<String, NaturalKey> references;
    private final Set<String> authoritative;
    private final PageKind source;
    private final Instant fetchedAt;

    private StructuredRecord(Builder builder) {
        this.key = builder.key;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.references = Collections.unmodifiableMap(new LinkedHashMap<>(builder.references));
        this.authoritative = Collections.unmodifiableSet(new LinkedHashSet<>(builder.authoritative));
        this.source = Objects.requireNonNull(builder.source, "source");
        this.fetchedAt = Objects.requireNonNull(builder.fetchedAt, "fetchedAt");
    }

    public static Builder builder(EntityKind kind, String naturalKey) {
        return new Builder(new NaturalKey(kind, naturalKey));
    }

    public static Builder builder(NaturalKey key) {
        return new Builder(key);
    }

    public Builder toBuilder() {
        var builder = new Builder(key);
        builder.fields.putAll(fields);
        builder.references.putAll(references);
        builder.authoritative.addAll(authoritative);
        builder.source = source;
        builder.fetchedAt = fetchedAt;
        return builder;
    }

    public NaturalKey key() {
        return key;
    }

    public EntityKind kind() {
        return key.kind();
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public @Nullable Object field(String name) {
        return fields.get(name);
    }

    public Map<String, NaturalKey> references() {
        return references;
    }

    public boolean isAuthoritative(String field) {
        return authoritative.contains(field);
    }

    public Set<String> authoritativeFields() {
        return authoritative;
    }

    public PageKind source() {
        return source;
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "StructuredRecord[" + key + " " + fields + " refs=" + references + " from " + source + "]";
    }

    public static final class Builder {
        private final NaturalKey key;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final Map<String, NaturalKey> references = new LinkedHashMap<>();
        private final Set<String> authoritative = new LinkedHashSet<>();
        private PageKind source;
        private Instant fetchedAt;

        private Builder(NaturalKey key) {
            this.key = key;
        }

        /**
         * Sets a field. Null or blank values are treated as not observed and ignored.
         */
        public Builder field(String name, @Nullable String value) {
            if (value != null && !value.isBlank()) fields.put(name, value.strip());
            return this;
        }

        public Builder field(String name, @Nullable Integer value) {
            if (value != null) fields.put(name, value);
            return this;
        }

        public Builder field(String name, @Nullable Boolean value) {
            if (value != null) fields.put(name, value);
            return this;
        }

        /**
         * Sets a field this record's page is the authority for.
         */
        public Builder authoritativeField(String name, @Nullable String value) {
            field(name, value);
            authoritative.add(name);
            return this;
        }

        public Builder authoritativeField(String name, @Nullable Integer value) {
            field(name, value);
            authoritative.add(name);
            return this;
        }

        public Builder authoritativeField(String name, @Nullable Boolean value) {
            field(name, value);
            authoritative.add(name);
            return this;
        }

        public Builder seenIn(int year) {
            fields.put(FIRST_YEAR, year);
            fields.put(LAST_YEAR, year);
            return this;
        }

        public Builder reference(String name, @Nullable NaturalKey target) {
            if (target != null) references.put(name, target);
            return this;
        }

        public Builder source(PageKind source, Instant fetchedAt) {
            this.source = source;
            this.fetchedAt = fetchedAt;
            return this;
        }

        public StructuredRecord build() {
            return new StructuredRecord(this);
        }
    }
}
