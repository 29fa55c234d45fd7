package org.clipcrawl.ingest;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.clipcrawl.portal.RawPage;
import org.netpreserve.jwarc.MediaType;
import org.netpreserve.jwarc.WarcCompression;
import org.netpreserve.jwarc.WarcMetadata;
import org.netpreserve.jwarc.WarcResource;
import org.netpreserve.jwarc.WarcWriter;
import org.netpreserve.jwarc.Warcinfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Keeps pages that failed to parse, as WARC resource records followed by a metadata record naming
 * the target and the error. Files are rotated once they pass {@link #MAX_FILE_SIZE}.
 */
public class PageArchive implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(PageArchive.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    static final long MAX_FILE_SIZE = 1024L * 1024 * 1024;
    private final Path directory;
    private final String prefix;
    private final URI baseUri;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();
    private WarcWriter writer;
    private String filename;
    private int sequence;

    public PageArchive(Path directory, String prefix, URI baseUri) throws IOException {
        this.directory = directory;
        this.prefix = prefix;
        this.baseUri = baseUri;
        Files.createDirectories(directory);
    }

    public synchronized void save(RawPage page, String error) throws IOException {
        if (writer == null) open();
        Instant date = page.fetchedAt();
        String contentType = page.contentType() == null ? "application/octet-stream" : page.contentType();
        // Paths are already percent-encoded in Latin-1; handing jwarc a URI would encode them again.
        String targetUri = page.target().uri(baseUri).toString();
        WarcResource resource = new WarcResource.Builder(URI.create(targetUri))
                .recordId(uuidGenerator.construct(date.toEpochMilli()))
                .date(date)
                .body(MediaType.parse(contentType), page.content())
                .build();
        var fields = new TreeMap<String, List<String>>();
        fields.put("target", List.of(page.target().key()));
        fields.put("status", List.of(String.valueOf(page.status())));
        fields.put("error", List.of(error));
        if (page.target().via() != null) fields.put("via", List.of(page.target().via()));
        WarcMetadata metadata = new WarcMetadata.Builder()
                .recordId(uuidGenerator.construct(date.toEpochMilli()))
                .targetURI(targetUri)
                .date(date)
                .concurrentTo(resource.id())
                .fields(fields)
                .build();
        writer.write(resource);
        writer.write(metadata);
        log.atDebug().addKeyValue("target", page.target().key()).addKeyValue("file", filename).log("Archived failed page");
        if (writer.position() > MAX_FILE_SIZE) {
            writer.close();
            writer = null;
        }
    }

    private void open() throws IOException {
        filename = prefix + "-failed-" + DATE_FORMAT.format(Instant.now()) + "-" + (sequence++) + ".warc.gz";
        writer = new WarcWriter(FileChannel.open(directory.resolve(filename), WRITE, CREATE, TRUNCATE_EXISTING),
                WarcCompression.GZIP);
        writer.write(new Warcinfo.Builder()
                .filename(filename)
                .fields(Map.of("software", List.of("clipcrawl"),
                        "format", List.of("WARC File Format 1.0")))
                .build());
    }

    synchronized String filename() {
        return filename;
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
