package org.clipcrawl.parse;

import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URLDecoder;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Documents uploaded to a class instance.
 */
final class FilePages {
    private FilePages() {
    }

    static ParseResult fileTypes(RawPage page) {
        CrawlTarget target = page.target();
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.FILE_TYPE)) {
            result.discover(target.child(PageKind.CLASS_FILES, "file_type", link.id()));
        }
        return result.build();
    }

    /**
     * Lists the files of one document type. Rows hold the file link followed by size, upload time
     * and uploader.
     */
    static ParseResult files(RawPage page) {
        CrawlTarget target = page.target();
        NaturalKey classKey = Keys.classOf(target);
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.FILE)) {
            String name = URLDecoder.decode(link.match().group(2), ISO_8859_1);
            var record = StructuredRecord.builder(Keys.file(link.id()))
                    .authoritativeField("name", name)
                    .authoritativeField("file_type", target.param("file_type"))
                    .reference("class", classKey);
            Element row = link.element().closest("tr");
            if (row != null) {
                Elements cells = row.select("> td");
                if (cells.size() >= 4) {
                    record.field("reported_size", cells.get(1).text())
                            .field("uploaded_at", cells.get(2).text())
                            .field("uploader", cells.get(3).text());
                }
            }
            result.record(record.source(target.kind(), page.fetchedAt()).build());
            result.discover(target.child(PageKind.FILE_DOWNLOAD, "file", link.id()));
        }
        return result.build();
    }

    static ParseResult download(RawPage page) {
        CrawlTarget target = page.target();
        NaturalKey key = Keys.file(target.param("file"));
        return ParseResult.builder()
                .record(StructuredRecord.builder(key)
                        .authoritativeField("media_type", page.mediaType())
                        .authoritativeField("size", page.content().length)
                        .source(target.kind(), page.fetchedAt())
                        .build())
                .attachment(new ParseResult.Attachment(key, page.content(), page.mediaType()))
                .build();
    }
}
