package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * What a class instance publishes about itself: the bilingual information sections, its calendar of
 * evaluation events and the summaries of past lessons.
 */
final class ClassInfoPages {
    private static final Logger log = LoggerFactory.getLogger(ClassInfoPages.class);

    static final List<PageKind> SECTIONS = List.of(PageKind.CLASS_DESCRIPTION, PageKind.CLASS_OBJECTIVES,
            PageKind.CLASS_REQUIREMENTS, PageKind.CLASS_COMPETENCES, PageKind.CLASS_PROGRAM,
            PageKind.CLASS_BIBLIOGRAPHY, PageKind.CLASS_TEACHING_METHODS, PageKind.CLASS_EVALUATION_METHODS,
            PageKind.CLASS_ASSISTANCE);
    /**
     * Edits made by the portal itself rather than a person.
     */
    static final String SYSTEM_EDITOR = "Agente de sistema";
    private static final DateTimeFormatter EDITED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int EVENT_COLUMNS = 7;
    private static final int SUMMARY_COLUMNS = 9;
    /**
     * Lesson places look like {@code Ed 2: Lab 123 A/Ed.2}.
     */
    private static final Pattern PLACE = Pattern.compile("Ed .*: (?<room>[\\w. ]+)/(?<building>[\\w. ]+)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private ClassInfoPages() {
    }

    /**
     * Field prefix for a section, e.g. {@code teaching_methods} for {@link PageKind#CLASS_TEACHING_METHODS}.
     */
    static String section(PageKind kind) {
        return kind.name().substring("CLASS_".length()).toLowerCase(Locale.ROOT);
    }

    /**
     * One information section. The page holds a Portuguese and an English pane, kept as markup, and a
     * footer naming the last editor and the edit time.
     */
    static ParseResult info(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        doc.outputSettings().prettyPrint(false);
        Element table = doc.selectFirst("table[width=\"75%\"][bgcolor=\"#dddddd\"]");
        if (table == null) {
            throw new ParseException(EntityKind.CLASS_INSTANCE, target.kind(), "information table not found");
        }
        Elements panes = table.select("td[valign=top][bgcolor=\"#ffffff\"]");
        Elements footer = table.select("small");
        if (panes.size() < 2 || footer.size() < 2) {
            throw new ParseException(EntityKind.CLASS_INSTANCE, target.kind(),
                    panes.size() + " panes and " + footer.size() + " footer lines");
        }
        String section = section(target.kind());
        String editor = afterColon(footer.get(0).text());
        if (SYSTEM_EDITOR.equals(editor)) editor = null;
        String edited = afterColon(footer.get(1).text());
        return ParseResult.builder()
                .record(instance(target)
                        .source(target.kind(), page.fetchedAt())
                        .authoritativeField(section + "_pt", Text.blankToNull(panes.get(0).html()))
                        .authoritativeField(section + "_en", Text.blankToNull(panes.get(1).html()))
                        .authoritativeField(section + "_editor", editor)
                        .authoritativeField(section + "_edited",
                                edited == null ? null : LocalDateTime.parse(edited, EDITED).toString())
                        .build())
                .build();
    }

    /**
     * Evaluation calendar. Columns: date, start, end, type, season, description and notes. A class
     * without events has no calendar table.
     */
    static ParseResult events(RawPage page) {
        CrawlTarget target = page.target();
        Element table = tableWithHeader(Links.html(page), "Data");
        var result = ParseResult.builder();
        if (table == null) {
            log.atDebug().addKeyValue("target", target.key()).log("No events");
            return result.build();
        }
        NaturalKey instance = Keys.classInstance(target);
        for (Element row : table.select("tr")) {
            Elements cells = row.select("> td");
            if (cells.size() != EVENT_COLUMNS) continue;
            String date = Text.blankToNull(cells.get(0).text());
            String type = Text.blankToNull(cells.get(3).text());
            if (date == null || type == null) {
                log.atWarn().addKeyValue("target", target.key()).log("Event without date or type: {}", row.text());
                continue;
            }
            date = LocalDate.parse(date).toString();
            Integer start = time(cells.get(1).text());
            result.record(StructuredRecord.builder(Keys.classEvent(target, date, start, type))
                    .authoritativeField("date", date)
                    .authoritativeField("start", start)
                    .authoritativeField("end", time(cells.get(2).text()))
                    .authoritativeField("type", type)
                    .authoritativeField("season", Text.blankToNull(cells.get(4).text()))
                    .authoritativeField("info", Text.blankToNull(cells.get(5).text()))
                    .authoritativeField("note", Text.blankToNull(cells.get(6).text()))
                    .reference("class_instance", instance)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    /**
     * Lesson summaries. Each lesson is a title row (shift, teacher, date, place, start, duration and
     * attendance), a message row and an edit time row.
     */
    static ParseResult summaries(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        Document doc = Links.html(page);
        doc.outputSettings().prettyPrint(false);
        Element header = doc.selectFirst("th.center[colspan=8][bgcolor=\"#dddddd\"]");
        Element table = header == null ? null : header.closest("table");
        if (table == null) {
            throw new ParseException(EntityKind.CLASS_SUMMARY, target.kind(), "summary table not found");
        }
        Elements titles = table.select("tr.center[bgcolor=\"#aaaaaa\"]");
        Elements messages = table.select("tr[bgcolor=\"#eeeeee\"]");
        Elements edits = table.select("td[colspan=8][align=right]");
        if (titles.size() != messages.size() || titles.size() != edits.size()) {
            throw new ParseException(EntityKind.CLASS_SUMMARY, target.kind(), titles.size() + " titles, "
                    + messages.size() + " messages and " + edits.size() + " edit times");
        }
        NaturalKey instance = Keys.classInstance(target);
        var result = ParseResult.builder();
        for (int i = 0; i < titles.size(); i++) {
            Elements cells = titles.get(i).select("> td");
            if (cells.size() < SUMMARY_COLUMNS) {
                throw new ParseException(EntityKind.CLASS_SUMMARY, target.kind(),
                        "summary title with " + cells.size() + " cells");
            }
            String shift = cells.get(1).text().strip();
            LocalDateTime start = LocalDateTime.parse(cells.get(4).text().strip() + " " + cells.get(6).text().strip(),
                    EDITED);
            Matcher place = PLACE.matcher(Text.normalize(cells.get(5).text()));
            boolean placed = place.find();
            Element message = messages.get(i).selectFirst("> td");
            result.record(StructuredRecord.builder(Keys.classSummary(target, shift, start.toString()))
                    .authoritativeField("shift", shift)
                    .authoritativeField("teacher", Text.blankToNull(cells.get(3).text()))
                    .authoritativeField("start", start.toString())
                    .authoritativeField("duration", Text.minutes(cells.get(7).text()))
                    .authoritativeField("room", placed ? place.group("room").strip() : null)
                    .authoritativeField("building", placed ? place.group("building").strip() : null)
                    .authoritativeField("attendance", Text.integer(cells.get(8).text()))
                    .authoritativeField("message", message == null ? null : Text.blankToNull(message.html()))
                    .authoritativeField("edited", LocalDateTime.parse(
                            edits.get(i).text().strip().replaceFirst("^Alterado em:\\s*", ""), EDITED).toString())
                    .reference("class_instance", instance)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    /**
     * The class instance record every page of the instance contributes to.
     */
    static StructuredRecord.Builder instance(CrawlTarget target) {
        return StructuredRecord.builder(Keys.classInstance(target))
                .field("year", Text.year(target))
                .field("period", target.param("period_type") + target.param("period"))
                .reference("class", Keys.classOf(target));
    }

    static @Nullable Element tableWithHeader(Element root, String header) {
        for (Element th : root.select("th")) {
            if (th.text().strip().equals(header)) return th.closest("table");
        }
        return null;
    }

    private static @Nullable Integer time(String text) {
        String s = Text.blankToNull(text);
        return s == null ? null : Text.minutes(s);
    }

    private static @Nullable String afterColon(String text) {
        int colon = text.indexOf(':');
        return colon < 0 ? null : Text.blankToNull(text.substring(colon + 1));
    }
}
