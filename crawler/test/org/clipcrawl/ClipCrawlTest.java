package org.clipcrawl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.clipcrawl.config.JobConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ClipCrawlTest {
    @TempDir
    Path jobDir;

    @Test
    void jobConfigOverlaysDefaults() throws IOException {
        try (InputStream example = getClass().getResourceAsStream("config/example.yaml")) {
            Files.copy(example, jobDir.resolve("config.yaml"));
        }
        JobConfig config = ClipCrawl.loadConfig(ClipCrawl.yamlMapper(), jobDir);

        assertEquals(URI.create("https://clip.example.org"), config.portal().baseUrl());
        assertEquals("clipcrawl/0.1", config.portal().userAgent());
        assertEquals(Duration.ofMinutes(14), config.portal().sessionMaxAge());
        assertEquals(2, config.fetch().workers());
        assertEquals(4, config.fetch().burst());
        assertEquals(Duration.ofSeconds(90), config.fetch().maxBackoff());
        assertEquals(2020, config.crawl().firstYear());
        assertEquals("97747", config.crawl().institution());
        assertEquals(3, config.crawl().maxPasses());
    }

    @Test
    void credentialsAreRequired() throws IOException {
        Files.writeString(jobDir.resolve("config.yaml"), "crawl:\n  firstYear: 2020\n");
        var e = assertThrows(IOException.class, () -> ClipCrawl.loadConfig(ClipCrawl.yamlMapper(), jobDir));
        assertTrue(e.getMessage().contains("portal.username"));
    }

    @Test
    void deepMergeReplacesListsAndKeepsSiblings() throws IOException {
        ObjectMapper mapper = ClipCrawl.yamlMapper();
        var base = mapper.readTree("a: {b: 1, c: [1, 2]}\nd: x\n");
        var override = mapper.readTree("a: {c: [3]}\ne: y\n");

        var merged = ClipCrawl.deepMerge(base, override);

        assertEquals(mapper.readTree("a: {b: 1, c: [3]}\nd: x\ne: y\n"), merged);
    }
}
