package org.clipcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.util.ByteSizeDeserializer;
import org.clipcrawl.util.DurationDeserializer;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;

/**
 * What an ingestion pass covers and how it runs.
 *
 * @param institution       the portal's identifier of the institution
 * @param firstYear         earliest academic year to seed
 * @param lastYear          latest academic year to seed, defaults to next year
 * @param periods           academic periods as part and letter, e.g. {@code 1s} for the first semester
 * @param seeds             page kinds the pass starts from
 * @param degrees           degree levels whose statistics pages carry course abbreviations
 * @param libraryDates      days to read library room availability for
 * @param batchSize         reconciled entities written per commit
 * @param maxPasses         rounds a retryable failure is re-attempted before it is reported as permanent
 * @param gracePeriod       how long a cancelled pass waits for in-flight fetches
 * @param maxAttachmentSize downloads larger than this are failed without being stored
 * @param progressInterval  how often progress is logged while a pass runs
 */
public record CrawlConfig(
        String institution,
        int firstYear,
        @Nullable Integer lastYear,
        List<String> periods,
        List<PageKind> seeds,
        List<String> degrees,
        List<LocalDate> libraryDates,
        int batchSize,
        int maxPasses,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration gracePeriod,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long maxAttachmentSize,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration progressInterval) {

    public CrawlConfig {
        if (institution == null) institution = "97747";
        if (firstYear <= 0) firstYear = 2001;
        if (periods == null) periods = List.of("1a", "1s", "2s", "1t", "2t", "3t", "4t");
        if (seeds == null) seeds = List.of(PageKind.DEPARTMENTS, PageKind.COURSES, PageKind.COURSE_STATISTICS,
                PageKind.BUILDINGS, PageKind.ADMISSIONS);
        if (degrees == null) degrees = List.of("L", "M", "D");
        if (libraryDates == null) libraryDates = List.of();
        if (batchSize < 1) batchSize = 100;
        if (maxPasses < 1) maxPasses = 3;
        if (gracePeriod == null) gracePeriod = Duration.ofSeconds(30);
        if (maxAttachmentSize == null) maxAttachmentSize = 256L * 1024 * 1024;
        if (progressInterval == null) progressInterval = Duration.ofMinutes(1);
        for (String period : periods) {
            if (!period.matches("\\d[a-z]")) {
                throw new IllegalArgumentException("Invalid period " + period + ", expected part and letter like 1s");
            }
        }
    }

    public int lastYearOrDefault() {
        return lastYear != null ? lastYear : Year.now().getValue() + 1;
    }
}
