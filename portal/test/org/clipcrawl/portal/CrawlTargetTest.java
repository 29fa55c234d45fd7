package org.clipcrawl.portal;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class CrawlTargetTest {
    @Test
    void keyIsIndependentOfParameterOrder() {
        var a = CrawlTarget.of(PageKind.DEPARTMENTS, "year", "2020", "institution", "97747");
        var b = CrawlTarget.of(PageKind.DEPARTMENTS, "institution", "97747", "year", "2020");
        assertEquals(a.key(), b.key());
        assertEquals("DEPARTMENTS?institution=97747&year=2020", a.key());
    }

    @Test
    void keyParsesBack() {
        var target = CrawlTarget.of(PageKind.LIBRARY_ROOMS, "data", "2020-03-02", "room type", "grupo & individual");
        var parsed = CrawlTarget.fromKey(target.key(), "via");
        assertEquals(target.params(), parsed.params());
        assertEquals(target.kind(), parsed.kind());
        assertEquals("via", parsed.via());
    }

    @Test
    void childInheritsOnlyItsOwnPathParameters() {
        var department = CrawlTarget.of(PageKind.DEPARTMENT_PERIODS,
                "year", "2020", "institution", "97747", "department", "12");
        var classes = department.child(PageKind.DEPARTMENT_CLASSES, "period", "1", "period_type", "s");
        assertEquals(department.key(), classes.via());
        assertEquals("12", classes.param("department"));
        assertEquals("s", classes.param("period_type"));

        var file = classes.child(PageKind.FILE_DOWNLOAD, "file", "555");
        assertEquals(1, file.params().size());
        assertEquals(URI.create("http://portal.test/objecto?oid=555"), file.uri(URI.create("http://portal.test/")));
    }

    @Test
    void missingPathParameterIsRejected() {
        var target = CrawlTarget.of(PageKind.DEPARTMENTS, "year", "2020");
        assertThrows(IllegalArgumentException.class, () -> target.uri(URI.create("http://portal.test")));
    }

    @Test
    void shiftPageKeepsItsLatinOneEscapes() {
        var shift = CrawlTarget.of(PageKind.CLASS_SHIFT, "institution", "97747", "year", "2023", "period_type", "s",
                "period", "1", "department", "42", "class", "11153", "shift_type", "TP", "shift", "3");
        String uri = shift.uri(URI.create("http://portal.test")).toString();
        assertTrue(uri.endsWith("&unidade_curricular=11153&tipo=TP&n%BA=3"), uri);
        assertTrue(uri.contains("/actividade/turnos?tipo_de_per%EDodo_lectivo=s&"), uri);
    }
}
