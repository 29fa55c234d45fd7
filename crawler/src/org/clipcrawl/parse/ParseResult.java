package org.clipcrawl.parse;

import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.portal.CrawlTarget;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a parser read from a page.
 *
 * @param records     partial views of the entities on the page
 * @param discovered  targets linked from the page
 * @param attachments binary content to be stored, keyed to the entity that owns it
 */
public record ParseResult(List<StructuredRecord> records, List<CrawlTarget> discovered, List<Attachment> attachments) {
    public ParseResult {
        records = List.copyOf(records);
        discovered = List.copyOf(discovered);
        attachments = List.copyOf(attachments);
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Downloaded bytes belonging to an entity. The entity gets a {@code content_hash} field once they
     * are stored.
     */
    public record Attachment(NaturalKey owner, byte[] content, @Nullable String mediaType) {
    }

    public static class Builder {
        private final List<StructuredRecord> records = new ArrayList<>();
        private final Map<String, CrawlTarget> discovered = new LinkedHashMap<>();
        private final List<Attachment> attachments = new ArrayList<>();

        public Builder record(StructuredRecord record) {
            records.add(record);
            return this;
        }

        public Builder discover(CrawlTarget target) {
            discovered.putIfAbsent(target.key(), target);
            return this;
        }

        public Builder attachment(Attachment attachment) {
            attachments.add(attachment);
            return this;
        }

        public int recordCount() {
            return records.size();
        }

        public ParseResult build() {
            return new ParseResult(records, new ArrayList<>(discovered.values()), attachments);
        }
    }
}
