package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.model.RoomType;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class PageParsersTest {
    private static final Instant FETCHED = Instant.parse("2024-02-01T12:00:00Z");
    private static final CrawlTarget CLASS_INSTANCE = CrawlTarget.of(PageKind.CLASS_ENROLLED,
            "institution", "97747", "year", "2023", "period_type", "s", "period", "1",
            "department", "42", "class", "11153");
    private final PageParsers parsers = new PageParsers();

    @Test
    void departments() throws Exception {
        var target = CrawlTarget.of(PageKind.DEPARTMENTS, "institution", "97747", "year", "2023");
        ParseResult result = parsers.parse(page(target, "departments.html"));

        assertEquals(2, result.records().size());
        StructuredRecord first = result.records().get(0);
        assertEquals(new NaturalKey(EntityKind.DEPARTMENT, "42"), first.key());
        assertEquals("Departamento de Informática", first.field("name"));
        assertTrue(first.isAuthoritative("name"));
        assertEquals(2023, first.field(StructuredRecord.FIRST_YEAR));
        assertEquals(List.of("42", "43"), result.discovered().stream().map(t -> t.param("department")).toList());
        assertTrue(result.discovered().stream().allMatch(t -> t.kind() == PageKind.DEPARTMENT_PERIODS
                                                               && target.key().equals(t.via())));
    }

    @Test
    void departmentsWithoutLinksFail() {
        var target = CrawlTarget.of(PageKind.DEPARTMENTS, "institution", "97747", "year", "2023");
        var e = assertThrows(ParseException.class,
                () -> parsers.parse(page(target, "<html><body><p>Erro</p></body></html>".getBytes(UTF_8))));
        assertEquals(EntityKind.DEPARTMENT, e.entityKind());
        assertEquals(PageKind.DEPARTMENTS, e.pageKind());
    }

    @Test
    void periodsDiscoverClassesAndTeachersOncePerPeriod() throws Exception {
        var target = CrawlTarget.of(PageKind.DEPARTMENT_PERIODS, "institution", "97747", "year", "2023",
                "department", "42");
        ParseResult result = parsers.parse(page(target, "periods.html"));

        assertEquals(4, result.discovered().size());
        assertEquals(2, result.discovered().stream().filter(t -> t.kind() == PageKind.DEPARTMENT_CLASSES).count());
        assertTrue(result.discovered().stream().anyMatch(t -> t.kind() == PageKind.DEPARTMENT_TEACHERS
                                                              && t.param("period").equals("2")));
        assertEquals(1, result.records().size());
    }

    @Test
    void teachers() throws Exception {
        ParseResult result = parsers.parse(page(listing(PageKind.DEPARTMENT_TEACHERS), "teachers.html"));

        assertEquals(List.of("1001", "1002"), keys(result));
        assertEquals(new NaturalKey(EntityKind.DEPARTMENT, "42"), result.records().get(0).references().get("department"));
    }

    @Test
    void singleTeacherScheduleIgnoresLinksToCoTeachers() throws Exception {
        ParseResult result = parsers.parse(page(listing(PageKind.DEPARTMENT_TEACHERS), "teacher-schedule.html"));

        assertEquals(List.of("1001"), keys(result));
        assertEquals("Ana Lopes", result.records().get(0).field("name"));
    }

    @Test
    void classes() throws Exception {
        ParseResult result = parsers.parse(page(listing(PageKind.DEPARTMENT_CLASSES), "classes.html"));

        assertEquals(List.of("42:11153", "42:11154"), keys(result, EntityKind.CLASS));
        assertEquals(List.of("42:11153/2023/s1", "42:11154/2023/s1"), keys(result, EntityKind.CLASS_INSTANCE));
        assertEquals("Bases de Dados", result.records().get(0).field("name"));
        assertEquals(new NaturalKey(EntityKind.CLASS, "42:11153"), result.records().get(1).references().get("class"));
        assertEquals(30, result.discovered().size());
        CrawlTarget enrolled = result.discovered().get(0);
        assertEquals(PageKind.CLASS_ENROLLED, enrolled.kind());
        assertEquals("11153", enrolled.param("class"));
        assertEquals("s", enrolled.param("period_type"));
        assertTrue(result.discovered().stream().anyMatch(t -> t.kind() == PageKind.CLASS_SHIFTS
                                                              && t.param("class").equals("11154")));
        assertEquals(2, result.discovered().stream().filter(t -> t.kind() == PageKind.CLASS_BIBLIOGRAPHY).count());
    }

    @Test
    void classInformationSection() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_DESCRIPTION);
        ParseResult result = parsers.parse(page(target, "class-description.html"));

        assertEquals(1, result.records().size());
        StructuredRecord instance = result.records().get(0);
        assertEquals(new NaturalKey(EntityKind.CLASS_INSTANCE, "42:11153/2023/s1"), instance.key());
        assertEquals("<p>Modelo relacional e <b>SQL</b>.</p>", instance.field("description_pt"));
        assertEquals("<p>Relational model and <b>SQL</b>.</p>", instance.field("description_en"));
        assertEquals("Ana Lopes", instance.field("description_editor"));
        assertEquals("2023-09-14T18:05", instance.field("description_edited"));
        assertTrue(instance.isAuthoritative("description_pt"));
        assertEquals(2023, instance.field("year"));
        assertEquals(new NaturalKey(EntityKind.CLASS, "42:11153"), instance.references().get("class"));
    }

    @Test
    void everySectionWritesItsOwnFields() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_TEACHING_METHODS);
        StructuredRecord instance = parsers.parse(page(target, "class-description.html")).records().get(0);

        assertEquals("Ana Lopes", instance.field("teaching_methods_editor"));
        assertNull(instance.field("description_pt"));
    }

    @Test
    void sectionsEditedByThePortalHaveNoEditor() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_PROGRAM);
        String html = new String(resource("class-description.html"), UTF_8)
                .replace("Alterado por: Ana Lopes", "Alterado por: " + ClassInfoPages.SYSTEM_EDITOR);
        StructuredRecord instance = parsers.parse(page(target, html.getBytes(UTF_8))).records().get(0);

        assertNull(instance.field("program_editor"));
        assertTrue(instance.isAuthoritative("program_editor"));
    }

    @Test
    void classInformationWithoutTableFails() {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_OBJECTIVES);
        var e = assertThrows(ParseException.class,
                () -> parsers.parse(page(target, "<html><body></body></html>".getBytes(UTF_8))));
        assertEquals(EntityKind.CLASS_INSTANCE, e.entityKind());
    }

    @Test
    void classEvents() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_EVENTS);
        ParseResult result = parsers.parse(page(target, "class-events.html"));

        assertEquals(List.of("42:11153/2023/s1/2023-11-04/540/Teste", "42:11153/2023/s1/2024-01-15/840/Exame"),
                keys(result));
        StructuredRecord test = result.records().get(0);
        assertEquals(660, test.field("end"));
        assertEquals("Normal", test.field("season"));
        assertEquals("1º teste", test.field("info"));
        assertNull(test.field("note"));
        assertEquals("Ed 2", result.records().get(1).field("note"));
        assertEquals(new NaturalKey(EntityKind.CLASS_INSTANCE, "42:11153/2023/s1"),
                test.references().get("class_instance"));
    }

    @Test
    void classWithoutEventsHasNone() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_EVENTS);
        ParseResult result = parsers.parse(page(target, "<html><body><p>Sem eventos</p></body></html>".getBytes(UTF_8)));
        assertTrue(result.records().isEmpty());
    }

    @Test
    void classSummaries() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SUMMARIES);
        ParseResult result = parsers.parse(page(target, "class-summaries.html"));

        assertEquals(List.of("42:11153/2023/s1/T1/2023-09-18T09:00", "42:11153/2023/s1/P2/2023-09-19T14:30"),
                keys(result));
        StructuredRecord first = result.records().get(0);
        assertEquals("Ana Lopes", first.field("teacher"));
        assertEquals(120, first.field("duration"));
        assertEquals("Sala 127", first.field("room"));
        assertEquals("Ed.2", first.field("building"));
        assertEquals(41, first.field("attendance"));
        assertEquals("<p>Apresentação da disciplina.</p>", first.field("message"));
        assertEquals("2023-09-18T11:30", first.field("edited"));
        StructuredRecord second = result.records().get(1);
        assertEquals(90, second.field("duration"));
        assertNull(second.field("room"));
        assertNull(second.field("attendance"));
    }

    @Test
    void summariesWithMissingRowsFail() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SUMMARIES);
        String html = new String(resource("class-summaries.html"), UTF_8)
                .replace("<tr><td colspan=\"8\" align=\"right\">Alterado em: 2023-09-20 08:00</td></tr>", "");
        var e = assertThrows(ParseException.class, () -> parsers.parse(page(target, html.getBytes(UTF_8))));
        assertEquals(EntityKind.CLASS_SUMMARY, e.entityKind());
    }

    @Test
    void shiftListDiscoversEachShiftOfThisInstance() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SHIFTS);
        ParseResult result = parsers.parse(page(target, "shifts.html"));

        assertTrue(result.records().isEmpty());
        assertEquals(List.of("T1", "P1", "P2"),
                result.discovered().stream().map(t -> t.param("shift_type") + t.param("shift")).toList());
        CrawlTarget shift = result.discovered().get(0);
        assertEquals(PageKind.CLASS_SHIFT, shift.kind());
        assertEquals("11153", shift.param("class"));
        assertEquals("2023", shift.param("year"));
    }

    @Test
    void shift() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SHIFT, "shift_type", "P", "shift", "2");
        ParseResult result = parsers.parse(page(target, "shift.html"));

        StructuredRecord shift = result.records().get(0);
        assertEquals(new NaturalKey(EntityKind.SHIFT, "42:11153/2023/s1/P2"), shift.key());
        assertEquals("0 480-600 Lab 123 A/Ed.2;3 840-930", shift.field("schedule"));
        assertEquals("Ana Lopes;Rui Alves", shift.field("teachers"));
        assertEquals("MIEI", shift.field("routes"));
        assertEquals(210, shift.field("weekly_minutes"));
        assertEquals("Aberto", shift.field("state"));
        assertEquals(2, shift.field("enrolled"));
        assertEquals(30, shift.field("capacity"));
        assertEquals("Só MIEI", shift.field("restrictions"));
        assertEquals(new NaturalKey(EntityKind.CLASS_INSTANCE, "42:11153/2023/s1"),
                shift.references().get("class_instance"));

        assertEquals(List.of("7", "8"), keys(result, EntityKind.STUDENT));
        assertEquals(List.of("7@42:11153/2023/s1/P2", "8@42:11153/2023/s1/P2"),
                keys(result, EntityKind.SHIFT_ENROLLMENT));
        StructuredRecord student = result.records().get(1);
        assertEquals("j.smith", student.field("abbreviation"));
        assertFalse(student.isAuthoritative("name"));
    }

    @Test
    void singleShiftIsParsedFromTheListPage() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SHIFTS);
        ParseResult result = parsers.parse(page(target, "shift.html"));

        assertTrue(result.discovered().isEmpty());
        assertEquals(List.of("42:11153/2023/s1/P2"), keys(result, EntityKind.SHIFT));
        assertEquals(2, keys(result, EntityKind.SHIFT_ENROLLMENT).size());
    }

    @Test
    void unknownShiftFieldFails() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_SHIFT, "shift_type", "P", "shift", "2");
        String html = new String(resource("shift.html"), UTF_8).replace("Estado", "Cor");
        var e = assertThrows(ParseException.class, () -> parsers.parse(page(target, html.getBytes(UTF_8))));
        assertEquals(EntityKind.SHIFT, e.entityKind());
    }

    @Test
    void textHelpers() {
        assertEquals(0, Text.weekday("Segunda-Feira"));
        assertEquals(5, Text.weekday("Sabado"));
        assertEquals(5, Text.weekday("Sábado"));
        assertNull(Text.weekday("Someday"));
        assertEquals(570, Text.minutes("09:30"));
    }

    @Test
    void enrolmentFile() throws Exception {
        ParseResult result = parsers.parse(page(CLASS_INSTANCE, "enrolled.txt"));

        assertEquals(4, result.records().size());
        StructuredRecord student = result.records().get(0);
        assertEquals(new NaturalKey(EntityKind.STUDENT, "7"), student.key());
        assertEquals("John Smith", student.field("name"));
        assertEquals("j.smith", student.field("abbreviation"));

        StructuredRecord enrollment = result.records().get(1);
        assertEquals("7@42:11153/2023/s1", enrollment.key().value());
        assertEquals(1, enrollment.field("attempt"));
        assertEquals(3, enrollment.field("student_year"));
        assertNull(enrollment.field("statutes"));
        assertEquals(new NaturalKey(EntityKind.CLASS, "42:11153"), enrollment.references().get("class"));
        assertEquals("TE", result.records().get(3).field("statutes"));
    }

    @Test
    void enrolmentFileWithoutHeaderFails() {
        assertThrows(ParseException.class, () -> parsers.parse(page(CLASS_INSTANCE, "Pauta\n".getBytes(UTF_8))));
    }

    @Test
    void enrolmentWithoutNameFails() {
        byte[] content = "a\nb\nc\nd\nTE\t \t7\tx\tMIEI\t1\t1\n".getBytes(UTF_8);
        var e = assertThrows(ParseException.class, () -> parsers.parse(page(CLASS_INSTANCE, content)));
        assertEquals(EntityKind.STUDENT, e.entityKind());
    }

    @Test
    void results() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_RESULTS);
        ParseResult result = parsers.parse(page(target, "results.html"));

        List<StructuredRecord> enrollments = result.records().stream()
                .filter(r -> r.kind() == EntityKind.ENROLLMENT).toList();
        assertEquals(3, enrollments.size());
        assertEquals(15, enrollments.get(0).field("grade"));
        assertEquals(true, enrollments.get(0).field("approved"));
        assertTrue(enrollments.get(0).isAuthoritative("grade"));
        assertNull(enrollments.get(1).field("grade"));
        assertEquals(false, enrollments.get(1).field("approved"));
        assertEquals(9, enrollments.get(2).field("grade"));
        assertEquals(false, enrollments.get(2).field("approved"));
        assertEquals("8@42:11153/2023/s1", enrollments.get(1).key().value());
    }

    @Test
    void resultsWithoutTableFail() {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_RESULTS);
        assertThrows(ParseException.class, () -> parsers.parse(page(target, "<html></html>".getBytes(UTF_8))));
    }

    @Test
    void admitted() throws Exception {
        var target = CrawlTarget.of(PageKind.ADMITTED, "institution", "97747", "year", "2023",
                "course", "11", "phase", "1");
        ParseResult result = parsers.parse(page(target, "admitted.html"));

        assertEquals(3, result.records().size());
        StructuredRecord admission = result.records().get(0);
        assertEquals("2023:1:11:7", admission.key().value());
        assertEquals(1, admission.field("option"));
        assertEquals("Matriculado", admission.field("state"));
        assertEquals(new NaturalKey(EntityKind.STUDENT, "7"), admission.references().get("student"));
        StructuredRecord student = result.records().get(1);
        assertEquals(EntityKind.STUDENT, student.kind());
        assertFalse(student.isAuthoritative("name"));
        assertEquals("2023:1:11:Joana Reis", result.records().get(2).key().value());
    }

    @Test
    void admittedWithoutAnchorFails() {
        var target = CrawlTarget.of(PageKind.ADMITTED, "institution", "97747", "year", "2023",
                "course", "11", "phase", "1");
        var e = assertThrows(ParseException.class,
                () -> parsers.parse(page(target, "<table><tr><th>Colocados</th></tr></table>".getBytes(UTF_8))));
        assertEquals(EntityKind.ADMISSION_RECORD, e.entityKind());
    }

    @Test
    void filesAndDownload() throws Exception {
        var target = CLASS_INSTANCE.child(PageKind.CLASS_FILES, "file_type", "0ac");
        ParseResult result = parsers.parse(page(target, "files.html"));

        assertEquals(List.of("5001", "5002"), keys(result));
        StructuredRecord file = result.records().get(0);
        assertEquals("Enunciado do Projecto.pdf", file.field("name"));
        assertEquals("0ac", file.field("file_type"));
        assertEquals("Ana Lopes", file.field("uploader"));
        CrawlTarget download = result.discovered().get(0);
        assertEquals(PageKind.FILE_DOWNLOAD, download.kind());
        assertEquals("5001", download.param("file"));

        byte[] pdf = "%PDF-1.4".getBytes(UTF_8);
        ParseResult downloaded = parsers.parse(new RawPage(download, pdf, FETCHED, 200, "application/pdf"));
        assertEquals(1, downloaded.attachments().size());
        assertEquals(new NaturalKey(EntityKind.FILE_ATTACHMENT, "5001"), downloaded.attachments().get(0).owner());
        assertEquals(pdf.length, downloaded.records().get(0).field("size"));
        assertEquals("application/pdf", downloaded.records().get(0).field("media_type"));
    }

    @Test
    void libraryRooms() throws Exception {
        var target = CrawlTarget.of(PageKind.LIBRARY_ROOMS, LibraryPages.DATE_PARAM, "2024-02-05");
        ParseResult result = parsers.parse(page(target, "library.html"));

        assertEquals(2, result.records().size());
        StructuredRecord room = result.records().get(0);
        assertEquals("2024-02-05/Sala 1", room.key().value());
        assertEquals(2, room.field("free_slots"));
        assertEquals(3, room.field("total_slots"));
        assertEquals(0, result.records().get(1).field("free_slots"));
    }

    @Test
    void buildingScheduleClassifiesRooms() throws Exception {
        var target = CrawlTarget.of(PageKind.BUILDING_SCHEDULE, "institution", "97747", "year", "2023",
                "period_type", "s", "period", "1", "building", "2", "weekday", "2");
        ParseResult result = parsers.parse(page(target, "building-schedule.html"));

        assertEquals(List.of("room/301", "room/302", "room/303"), keys(result));
        assertEquals("123", result.records().get(0).field("name"));
        assertEquals("LABORATORY", result.records().get(0).field("room_type"));
        assertEquals("CLASSROOM", result.records().get(1).field("room_type"));
        assertEquals("Bar Central", result.records().get(2).field("name"));
        assertEquals(new NaturalKey(EntityKind.PHYSICAL_SPACE, "building/2"),
                result.records().get(0).references().get("building"));
    }

    @Test
    void classify() {
        assertEquals(new SpacePages.RoomName(RoomType.CLASSROOM, "115"), SpacePages.classify("Sala de Aula Ed 2: 115"));
        assertEquals(new SpacePages.RoomName(RoomType.COMPUTER, "110"), SpacePages.classify("Sala de Computadores Ed 2: 110"));
        assertEquals(new SpacePages.RoomName(RoomType.MEETING_ROOM, "3.1"), SpacePages.classify("Sala de Reunião Ed 8: 3.1"));
        assertEquals(new SpacePages.RoomName(RoomType.MASTERS, "2.2"), SpacePages.classify("Sala de Mestrado Ed 2: 2.2"));
        assertEquals(new SpacePages.RoomName(RoomType.AUDITORIUM, "1A"), SpacePages.classify("Anfiteatro Ed 7: 1A"));
        assertEquals(new SpacePages.RoomName(RoomType.LABORATORY, "123"), SpacePages.classify("Laboratório de Ensino Ed 2: Lab 123"));
        assertEquals(new SpacePages.RoomName(RoomType.GENERIC, "Bar Central"), SpacePages.classify("Bar Central"));
    }

    @Test
    void unexpectedFailureBecomesParseException() {
        var custom = new PageParsers().with(PageKind.COURSES, page -> {
            throw new IllegalStateException("boom");
        });
        var target = CrawlTarget.of(PageKind.COURSES, "institution", "97747");
        var e = assertThrows(ParseException.class, () -> custom.parse(page(target, new byte[0])));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    private static CrawlTarget listing(PageKind kind) {
        return CrawlTarget.of(kind, "institution", "97747", "year", "2023", "period_type", "s", "period", "1",
                "department", "42");
    }

    private static List<String> keys(ParseResult result) {
        return result.records().stream().map(r -> r.key().value()).toList();
    }

    private static List<String> keys(ParseResult result, EntityKind kind) {
        return result.records().stream().filter(r -> r.kind() == kind).map(r -> r.key().value()).toList();
    }

    private static RawPage page(CrawlTarget target, String resource) throws IOException {
        return page(target, resource(resource));
    }

    private static byte[] resource(String name) throws IOException {
        try (InputStream stream = Objects.requireNonNull(PageParsersTest.class.getResourceAsStream(name), name)) {
            return stream.readAllBytes();
        }
    }

    private static RawPage page(CrawlTarget target, byte[] content) {
        return new RawPage(target, content, FETCHED, 200, "text/html; charset=UTF-8");
    }
}
