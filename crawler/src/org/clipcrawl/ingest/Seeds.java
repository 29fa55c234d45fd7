package org.clipcrawl.ingest;

import org.clipcrawl.config.CrawlConfig;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands the configured seed kinds into the targets a fresh pass starts from.
 */
final class Seeds {
    /**
     * Admission lists aren't published for earlier years.
     */
    static final int FIRST_ADMISSIONS_YEAR = 2006;

    private Seeds() {
    }

    static List<CrawlTarget> of(CrawlConfig config) {
        String institution = config.institution();
        int lastYear = config.lastYearOrDefault();
        List<CrawlTarget> seeds = new ArrayList<>();
        for (PageKind kind : config.seeds()) {
            switch (kind) {
                case COURSES -> seeds.add(CrawlTarget.of(kind, "institution", institution));
                case COURSE_STATISTICS -> {
                    for (String degree : config.degrees()) {
                        seeds.add(CrawlTarget.of(kind, "institution", institution, "degree", degree));
                    }
                }
                case DEPARTMENTS -> {
                    for (int year = config.firstYear(); year <= lastYear; year++) {
                        seeds.add(CrawlTarget.of(kind, "institution", institution, "year", String.valueOf(year)));
                    }
                }
                case ADMISSIONS -> {
                    for (int year = Math.max(config.firstYear(), FIRST_ADMISSIONS_YEAR); year <= lastYear; year++) {
                        seeds.add(CrawlTarget.of(kind, "institution", institution, "year", String.valueOf(year)));
                    }
                }
                case BUILDINGS -> {
                    for (int year = config.firstYear(); year <= lastYear; year++) {
                        for (String period : config.periods()) {
                            seeds.add(CrawlTarget.of(kind, "institution", institution, "year", String.valueOf(year),
                                    "period", period.substring(0, 1), "period_type", period.substring(1)));
                        }
                    }
                }
                case LIBRARY_ROOMS -> {
                    for (LocalDate date : config.libraryDates()) {
                        seeds.add(CrawlTarget.of(kind, "data", date.toString()));
                    }
                }
                default -> throw new IllegalArgumentException(kind + " can't be used as a seed");
            }
        }
        return seeds;
    }
}
