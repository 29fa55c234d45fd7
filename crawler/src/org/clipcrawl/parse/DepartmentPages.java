package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Document;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Department index and the per-department listings reached from it.
 */
final class DepartmentPages {
    /**
     * Pages fetched for every class instance besides its enrolment file.
     */
    private static final List<PageKind> CLASS_PAGES = Stream.concat(
            Stream.of(PageKind.CLASS_RESULTS, PageKind.CLASS_FILE_TYPES, PageKind.CLASS_SHIFTS,
                    PageKind.CLASS_EVENTS, PageKind.CLASS_SUMMARIES),
            ClassInfoPages.SECTIONS.stream()).toList();

    private DepartmentPages() {
    }

    static ParseResult departments(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        int year = Text.year(target);
        List<Link> links = Links.distinct(Links.html(page), Links.DEPARTMENT);
        if (links.isEmpty()) {
            throw new ParseException(EntityKind.DEPARTMENT, target.kind(), "no department links");
        }
        var result = ParseResult.builder();
        for (Link link : links) {
            result.record(StructuredRecord.builder(Keys.department(link.id()))
                    .authoritativeField("name", link.text())
                    .seenIn(year)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.discover(target.child(PageKind.DEPARTMENT_PERIODS, "department", link.id()));
        }
        return result.build();
    }

    /**
     * The academic periods a department taught in one year. A department with no periods that year
     * yields nothing.
     */
    static ParseResult periods(RawPage page) {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        Set<String> seen = new LinkedHashSet<>();
        var result = ParseResult.builder();
        for (Link link : Links.find(doc, Links.PERIOD_TYPE)) {
            String periodType = link.id();
            String period = Links.firstGroup(Links.PERIOD, link.href());
            if (period == null || !seen.add(periodType + period)) continue;
            result.discover(target.child(PageKind.DEPARTMENT_CLASSES, "period_type", periodType, "period", period));
            result.discover(target.child(PageKind.DEPARTMENT_TEACHERS, "period_type", periodType, "period", period));
        }
        if (!seen.isEmpty()) {
            result.record(StructuredRecord.builder(Keys.department(target.param("department")))
                    .seenIn(Text.year(target))
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    static ParseResult teachers(RawPage page) {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        List<Link> links = Links.distinct(doc, Links.TEACHER);
        // With a single teacher the portal shows that teacher's schedule instead of the list, and the
        // other teacher links on it belong to shared classes.
        boolean schedule = doc.select("a").stream().anyMatch(a -> a.text().strip().equals("Ficheiro"));
        if (schedule && links.size() > 1) {
            links = links.subList(0, 1);
        }
        int year = Text.year(target);
        var result = ParseResult.builder();
        for (Link link : links) {
            result.record(StructuredRecord.builder(Keys.teacher(link.id()))
                    .authoritativeField("name", link.text())
                    .seenIn(year)
                    .reference("department", Keys.department(target.param("department")))
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    static ParseResult classes(RawPage page) {
        CrawlTarget target = page.target();
        int year = Text.year(target);
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.CLASS)) {
            CrawlTarget instance = target.child(PageKind.CLASS_ENROLLED, "class", link.id());
            result.record(StructuredRecord.builder(Keys.classOf(instance))
                    .authoritativeField("name", link.text())
                    .field("class_id", link.id())
                    .seenIn(year)
                    .reference("department", Keys.department(target.param("department")))
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.record(ClassInfoPages.instance(instance)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.discover(instance);
            for (PageKind kind : CLASS_PAGES) {
                result.discover(target.child(kind, "class", link.id()));
            }
        }
        return result.build();
    }
}
