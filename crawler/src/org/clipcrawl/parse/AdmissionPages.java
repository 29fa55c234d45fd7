package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AdmissionPages {
    private static final Logger log = LoggerFactory.getLogger(AdmissionPages.class);
    static final int PHASES = 3;

    private AdmissionPages() {
    }

    /**
     * Courses that admitted students in a year. Each course has one list per admission phase.
     */
    static ParseResult admissions(RawPage page) {
        CrawlTarget target = page.target();
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.COURSE)) {
            for (int phase = 1; phase <= PHASES; phase++) {
                result.discover(target.child(PageKind.ADMITTED, "course", link.id(), "phase", String.valueOf(phase)));
            }
        }
        return result.build();
    }

    static ParseResult admitted(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        Element header = Links.html(page).selectFirst("th[colspan=8][bgcolor=#95AEA8]");
        if (header == null || header.parent() == null || header.parent().parent() == null) {
            throw new ParseException(EntityKind.ADMISSION_RECORD, target.kind(), "admission table not found");
        }
        Element table = header.parent().parent();
        int year = Text.year(target);
        NaturalKey course = Keys.course(target.param("course"));
        var result = ParseResult.builder();
        for (Element row : table.select("tr")) {
            if (!row.select("th").isEmpty()) continue;
            Elements cells = row.select("> td");
            if (cells.size() < 7) {
                log.atWarn().addKeyValue("target", target.key()).log("Skipping admission row with {} cells", cells.size());
                continue;
            }
            String name = Text.blankToNull(cells.get(0).text());
            Integer option = Text.integer(cells.get(4).text());
            String studentId = Text.blankToNull(cells.get(5).text());
            String state = Text.blankToNull(cells.get(6).text());
            if (studentId == null && name == null) continue;

            NaturalKey student = studentId == null ? null : Keys.student(studentId);
            result.record(StructuredRecord.builder(Keys.admission(target, studentId != null ? studentId : name))
                    .field("name", name)
                    .field("year", year)
                    .field("phase", Text.integer(target.param("phase")))
                    .authoritativeField("option", option)
                    .authoritativeField("state", state)
                    .reference("course", course)
                    .reference("student", student)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            if (student != null) {
                result.record(StructuredRecord.builder(student)
                        .field("name", name)
                        .seenIn(year)
                        .reference("course", course)
                        .source(target.kind(), page.fetchedAt())
                        .build());
            }
        }
        return result.build();
    }
}
