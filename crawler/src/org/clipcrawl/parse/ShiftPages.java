package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shifts (turnos) of a class instance: their schedule, teachers, capacity and students.
 */
final class ShiftPages {
    private static final Logger log = LoggerFactory.getLogger(ShiftPages.class);
    /**
     * Schedule lines look like {@code Segunda-Feira  08:00 - 10:00  Ed 2: Lab 123 A/Ed.2}, the place
     * being optional.
     */
    private static final Pattern SCHEDULE = Pattern.compile(
            "(?<weekday>[\\w-]+)\\s+(?<start>\\d{2}:\\d{2}) - (?<end>\\d{2}:\\d{2})\\s*" +
            "(?:Ed .*: (?<room>[\\w. ]+)/(?<building>[\\w. ]+))?",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final String FILE_LINK = "aux=ficheiro";
    private static final int STUDENT_COLUMNS = 4;

    private ShiftPages() {
    }

    /**
     * The shift list links to every shift. With a single shift the portal answers with the shift page
     * itself, recognisable by its student file link, and it is parsed in place.
     */
    static ParseResult shifts(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        // The choice bar links to the class's other instances.
        Element choices = doc.selectFirst("td.barra_de_escolhas");
        if (choices != null) choices.select("table").remove();

        boolean single = false;
        List<Link> shifts = new ArrayList<>();
        for (Link link : Links.find(doc, Links.SHIFT)) {
            if (link.href().toLowerCase(Locale.ROOT).contains(FILE_LINK)) {
                single = true;
            } else {
                shifts.add(link);
            }
        }
        if (single) {
            if (shifts.size() > 1) {
                throw new ParseException(EntityKind.SHIFT, target.kind(),
                        "shift page links to " + shifts.size() + " shifts");
            }
            if (shifts.isEmpty()) {
                log.atInfo().addKeyValue("target", target.key()).log("Shift page without any shift");
                return ParseResult.empty();
            }
            Link link = shifts.get(0);
            return shift(page, link.id(), Integer.parseInt(link.match().group(2)));
        }
        var result = ParseResult.builder();
        for (Link link : shifts) {
            result.discover(target.child(PageKind.CLASS_SHIFT, "shift_type", link.id(), "shift", link.match().group(2)));
        }
        return result.build();
    }

    static ParseResult shift(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        return shift(page, target.param("shift_type"), Integer.parseInt(target.param("shift")));
    }

    private static ParseResult shift(RawPage page, String type, int number) throws ParseException {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        NaturalKey shift = Keys.shift(target, type, number);
        var record = StructuredRecord.builder(shift)
                .authoritativeField("type", type)
                .authoritativeField("number", number)
                .reference("class_instance", Keys.classInstance(target))
                .source(target.kind(), page.fetchedAt());
        for (Map.Entry<String, List<String>> field : infoFields(doc, target).entrySet()) {
            List<String> values = field.getValue();
            String name = field.getKey();
            if (name.equals("marcação")) {
                List<String> sessions = new ArrayList<>();
                for (String line : values) {
                    sessions.add(session(line, target));
                }
                record.authoritativeField("schedule", String.join(";", sessions));
            } else if (name.equals("turno")) {
                continue;
            } else if (name.contains("percursos")) {
                record.authoritativeField("routes", String.join(";", values));
            } else if (name.equals("docentes")) {
                record.authoritativeField("teachers", String.join(";", values));
            } else if (name.contains("carga")) {
                String hours = values.get(0).replace("horas", "").replace(',', '.').strip();
                record.authoritativeField("weekly_minutes", (int) Math.round(Double.parseDouble(hours) * 60));
            } else if (name.equals("estado")) {
                record.authoritativeField("state", values.get(0));
            } else if (name.equals("capacidade")) {
                String[] parts = values.get(0).split("/");
                record.authoritativeField("enrolled", Text.integer(parts[0]));
                record.authoritativeField("capacity", parts.length > 1 ? Text.integer(parts[1]) : null);
            } else if (name.equals("restrição")) {
                record.authoritativeField("restrictions", values.get(0));
            } else {
                throw new ParseException(EntityKind.SHIFT, target.kind(), "unknown shift field " + name);
            }
        }
        var result = ParseResult.builder().record(record.build());
        students(doc, target, shift, page, result);
        return result.build();
    }

    /**
     * The details table has a label and a value per row. Multi-valued fields continue on rows holding
     * only a value.
     */
    private static Map<String, List<String>> infoFields(Document doc, CrawlTarget target) throws ParseException {
        Element header = doc.selectFirst("th[colspan=2][bgcolor=\"#aaaaaa\"]");
        Element table = header == null ? null : header.closest("table");
        if (table == null) {
            throw new ParseException(EntityKind.SHIFT, target.kind(), "shift details not found");
        }
        Map<String, List<String>> fields = new LinkedHashMap<>();
        List<String> current = null;
        for (Element row : table.select("tr")) {
            if (!row.select("> th").isEmpty()) continue;
            Elements cells = row.select("> td");
            if (cells.size() == 1) {
                if (current == null) {
                    throw new ParseException(EntityKind.SHIFT, target.kind(), "shift value without a label");
                }
                current.add(Text.normalize(cells.get(0).text()));
            } else if (cells.size() >= 2) {
                current = new ArrayList<>();
                current.add(Text.normalize(cells.get(1).text()));
                fields.put(Text.normalize(cells.get(0).text()).toLowerCase(Locale.ROOT), current);
            }
        }
        return fields;
    }

    /**
     * One weekly session as {@code weekday start-end} in minutes, followed by {@code room/building}
     * when the place is known.
     */
    static String session(String line, CrawlTarget target) throws ParseException {
        Matcher matcher = SCHEDULE.matcher(line);
        if (!matcher.find()) {
            throw new ParseException(EntityKind.SHIFT, target.kind(), "bad schedule " + line);
        }
        Integer weekday = Text.weekday(matcher.group("weekday"));
        if (weekday == null) {
            throw new ParseException(EntityKind.SHIFT, target.kind(), "unknown weekday " + matcher.group("weekday"));
        }
        String session = weekday + " " + Text.minutes(matcher.group("start")) + "-" + Text.minutes(matcher.group("end"));
        String room = matcher.group("room");
        String building = matcher.group("building");
        if (room != null && building != null) {
            session += " " + room.strip() + "/" + building.strip();
        }
        return session;
    }

    /**
     * Students table: name, number, abbreviation and course abbreviation.
     */
    private static void students(Document doc, CrawlTarget target, NaturalKey shift, RawPage page,
                                 ParseResult.Builder result) {
        Element header = doc.selectFirst("th[colspan=4][bgcolor=\"#95AEA8\"]");
        Element table = header == null ? null : header.closest("table");
        if (table == null) {
            log.atDebug().addKeyValue("target", target.key()).log("Shift without students");
            return;
        }
        int year = Text.year(target);
        for (Element row : table.select("tr")) {
            Elements cells = row.select("> td");
            if (cells.size() != STUDENT_COLUMNS) continue;
            String studentId = Text.blankToNull(cells.get(1).text());
            if (studentId == null) {
                log.atWarn().addKeyValue("target", target.key()).log("Shift student without number: {}", row.text());
                continue;
            }
            if (Text.integer(studentId) == null) {
                log.atWarn().addKeyValue("target", target.key()).log("Student with non-numeric number {}", studentId);
            }
            NaturalKey student = Keys.student(studentId);
            result.record(StructuredRecord.builder(student)
                    .field("name", Text.blankToNull(cells.get(0).text()))
                    .field("abbreviation", Text.blankToNull(cells.get(2).text()))
                    .field("course_abbreviation", Text.blankToNull(cells.get(3).text()))
                    .seenIn(year)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            result.record(StructuredRecord.builder(Keys.shiftEnrollment(studentId, shift))
                    .reference("student", student)
                    .reference("shift", shift)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
    }
}
