package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Pages of one class instance: its enrolment file and its results.
 */
final class ClassPages {
    private static final Logger log = LoggerFactory.getLogger(ClassPages.class);
    /**
     * The enrolment file starts with a fixed header.
     */
    private static final int ENROLLED_HEADER_LINES = 4;
    private static final int ENROLLED_COLUMNS = 7;
    private static final Pattern STUDENT_NUMBER = Pattern.compile("\\d+");
    private static final Pattern FAILED_GRADE = Pattern.compile("(?i)RE|Rep(rovado)?|F(alta)?");
    static final int PASSING_GRADE = 10;

    private ClassPages() {
    }

    /**
     * Parses the tab separated enrolment file. Columns: statutes, name, student number, student
     * abbreviation, course, attempt and student year.
     */
    static ParseResult enrolled(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        String[] lines = page.text().split("\\R");
        if (lines.length < ENROLLED_HEADER_LINES) {
            throw new ParseException(EntityKind.ENROLLMENT, target.kind(), "enrolment file header missing");
        }
        int year = Text.year(target);
        NaturalKey classKey = Keys.classOf(target);
        var result = ParseResult.builder();
        for (int i = ENROLLED_HEADER_LINES; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) continue;
            String[] columns = line.split("\t", -1);
            if (columns.length != ENROLLED_COLUMNS) {
                log.atWarn().addKeyValue("target", target.key()).addKeyValue("line", i + 1)
                        .log("Invalid enrolment line with {} columns", columns.length);
                continue;
            }
            String name = Text.blankToNull(columns[1]);
            if (name == null) {
                throw new ParseException(EntityKind.STUDENT, target.kind(), "student with no name on line " + (i + 1));
            }
            String studentId = Text.blankToNull(columns[2]);
            if (studentId == null) {
                log.atWarn().addKeyValue("target", target.key()).addKeyValue("line", i + 1)
                        .log("Enrolment of {} has no student number", name);
                continue;
            }
            NaturalKey student = Keys.student(studentId);
            result.record(StructuredRecord.builder(student)
                    .authoritativeField("name", name)
                    .authoritativeField("abbreviation", Text.blankToNull(columns[3]))
                    .field("course_abbreviation", Text.blankToNull(columns[4]))
                    .seenIn(year)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.record(StructuredRecord.builder(Keys.enrollment(studentId, target))
                    .field("year", year)
                    .field("period", target.param("period_type") + target.param("period"))
                    .authoritativeField("statutes", Text.blankToNull(columns[0]))
                    .authoritativeField("attempt", Text.integer(columns[5]))
                    .authoritativeField("student_year", Text.integer(columns[6]))
                    .reference("student", student)
                    .reference("class", classKey)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    /**
     * Final results of a class instance. Only this page may set an enrolment's grade and approval.
     * Rows are student number, name, then any evaluation columns with the final result last.
     */
    static ParseResult results(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        Element header = null;
        for (Element th : doc.select("th")) {
            if (th.text().strip().startsWith("Número")) {
                header = th;
                break;
            }
        }
        Element table = header == null ? null : header.closest("table");
        if (table == null) {
            throw new ParseException(EntityKind.ENROLLMENT, target.kind(), "results table not found");
        }
        int year = Text.year(target);
        NaturalKey classKey = Keys.classOf(target);
        var result = ParseResult.builder();
        for (Element row : table.select("tr")) {
            Elements cells = row.select("> td");
            if (cells.size() < 3) continue;
            String studentId = cells.get(0).text().strip();
            if (!STUDENT_NUMBER.matcher(studentId).matches()) continue;
            String finalResult = cells.get(cells.size() - 1).text().strip();
            Integer grade = Text.integer(finalResult);
            Boolean approved = null;
            if (grade != null) {
                approved = grade >= PASSING_GRADE;
            } else if (FAILED_GRADE.matcher(finalResult).matches()) {
                approved = false;
            }
            NaturalKey student = Keys.student(studentId);
            result.record(StructuredRecord.builder(student)
                    .field("name", Text.blankToNull(cells.get(1).text()))
                    .seenIn(year)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.record(StructuredRecord.builder(Keys.enrollment(studentId, target))
                    .authoritativeField("grade", grade)
                    .authoritativeField("approved", approved)
                    .reference("student", student)
                    .reference("class", classKey)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }
}
