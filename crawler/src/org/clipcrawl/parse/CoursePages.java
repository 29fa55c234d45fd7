package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;

import java.util.List;

final class CoursePages {
    private CoursePages() {
    }

    static ParseResult courses(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        List<Link> links = Links.distinct(Links.html(page), Links.COURSE);
        if (links.isEmpty()) {
            throw new ParseException(EntityKind.COURSE, target.kind(), "no course links");
        }
        var result = ParseResult.builder();
        for (Link link : links) {
            result.record(StructuredRecord.builder(Keys.course(link.id()))
                    .authoritativeField("name", link.text())
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.discover(target.child(PageKind.CURRICULAR_PLANS, "course", link.id()));
        }
        return result.build();
    }

    /**
     * A course's activity span: the earliest and latest year among its curricular plan links.
     */
    static ParseResult curricularPlans(RawPage page) {
        CrawlTarget target = page.target();
        Integer first = null;
        Integer last = null;
        for (Link link : Links.find(Links.html(page), Links.YEAR)) {
            int year = Integer.parseInt(link.id());
            if (first == null || year < first) first = year;
            if (last == null || year > last) last = year;
        }
        if (first == null) return ParseResult.empty();
        return ParseResult.builder()
                .record(StructuredRecord.builder(Keys.course(target.param("course")))
                        .field(StructuredRecord.FIRST_YEAR, first)
                        .field(StructuredRecord.LAST_YEAR, last)
                        .source(target.kind(), page.fetchedAt())
                        .build())
                .build();
    }

    /**
     * Course abbreviations, from the enrolment statistics of one degree level.
     */
    static ParseResult statistics(RawPage page) {
        CrawlTarget target = page.target();
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.COURSE)) {
            String abbreviation = link.element().ownText().strip();
            if (abbreviation.isEmpty()) continue;
            result.record(StructuredRecord.builder(Keys.course(link.id()))
                    .authoritativeField("abbreviation", abbreviation)
                    .authoritativeField("degree", target.param("degree"))
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }
}
