package org.clipcrawl.parse;

import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatches a page to the parser for its kind.
 */
public class PageParsers implements PageParser {
    private final Map<PageKind, PageParser> parsers = new EnumMap<>(PageKind.class);

    public PageParsers() {
        parsers.put(PageKind.DEPARTMENTS, DepartmentPages::departments);
        parsers.put(PageKind.DEPARTMENT_PERIODS, DepartmentPages::periods);
        parsers.put(PageKind.DEPARTMENT_TEACHERS, DepartmentPages::teachers);
        parsers.put(PageKind.DEPARTMENT_CLASSES, DepartmentPages::classes);
        parsers.put(PageKind.COURSES, CoursePages::courses);
        parsers.put(PageKind.CURRICULAR_PLANS, CoursePages::curricularPlans);
        parsers.put(PageKind.COURSE_STATISTICS, CoursePages::statistics);
        parsers.put(PageKind.BUILDINGS, SpacePages::buildings);
        parsers.put(PageKind.BUILDING_SCHEDULE, SpacePages::rooms);
        parsers.put(PageKind.ADMISSIONS, AdmissionPages::admissions);
        parsers.put(PageKind.ADMITTED, AdmissionPages::admitted);
        parsers.put(PageKind.CLASS_ENROLLED, ClassPages::enrolled);
        parsers.put(PageKind.CLASS_RESULTS, ClassPages::results);
        parsers.put(PageKind.CLASS_FILE_TYPES, FilePages::fileTypes);
        parsers.put(PageKind.CLASS_FILES, FilePages::files);
        for (PageKind section : ClassInfoPages.SECTIONS) {
            parsers.put(section, ClassInfoPages::info);
        }
        parsers.put(PageKind.CLASS_EVENTS, ClassInfoPages::events);
        parsers.put(PageKind.CLASS_SUMMARIES, ClassInfoPages::summaries);
        parsers.put(PageKind.CLASS_SHIFTS, ShiftPages::shifts);
        parsers.put(PageKind.CLASS_SHIFT, ShiftPages::shift);
        parsers.put(PageKind.FILE_DOWNLOAD, FilePages::download);
        parsers.put(PageKind.LIBRARY_ROOMS, LibraryPages::rooms);
    }

    /**
     * Replaces the parser for a page kind.
     */
    public PageParsers with(PageKind kind, PageParser parser) {
        parsers.put(kind, parser);
        return this;
    }

    @Override
    public ParseResult parse(RawPage page) throws ParseException {
        PageParser parser = parsers.get(page.target().kind());
        if (parser == null) {
            throw new ParseException(null, page.target().kind(), "no parser registered");
        }
        try {
            return parser.parse(page);
        } catch (RuntimeException e) {
            throw new ParseException(null, page.target().kind(), e.toString(), e);
        }
    }
}
