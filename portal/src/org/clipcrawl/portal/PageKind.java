package org.clipcrawl.portal;

import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * The kinds of portal page the crawler knows how to fetch. Each kind carries a path template whose
 * {@code {name}} placeholders are filled from the target's parameters. The portal expects its query
 * strings percent-encoded as Latin-1, so templates are stored already encoded.
 */
public enum PageKind {
    DEPARTMENTS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector?" +
            "ano_lectivo={year}&institui%E7%E3o={institution}"),
    DEPARTMENT_PERIODS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector?" +
            "institui%E7%E3o={institution}&ano_lectivo={year}&sector={department}"),
    DEPARTMENT_TEACHERS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/hor%E1rio/unidade_de_ensino/Docente?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}"),
    DEPARTMENT_CLASSES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}"),
    COURSES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/curso?institui%E7%E3o={institution}"),
    CURRICULAR_PLANS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/curso?" +
            "institui%E7%E3o={institution}&curso={course}"),
    COURSE_STATISTICS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/estat%EDstica/alunos/evolu%E7%E3o?" +
            "institui%E7%E3o={institution}&n%EDvel_acad%E9mico={degree}"),
    BUILDINGS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/hor%E1rio/espa%E7o?" +
            "tipo_de_per%EDodo_lectivo={period_type}&ano_lectivo={year}&per%EDodo_lectivo={period}" +
            "&institui%E7%E3o={institution}"),
    BUILDING_SCHEDULE(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/hor%E1rio/espa%E7o/ocupa%E7%E3o?" +
            "tipo_de_per%EDodo_lectivo={period_type}&ano_lectivo={year}&per%EDodo_lectivo={period}" +
            "&edif%EDcio={building}&institui%E7%E3o={institution}&dia_%FAtil_da_semana={weekday}"),
    ADMISSIONS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/candidaturas?" +
            "ano_lectivo={year}&institui%E7%E3o={institution}"),
    ADMITTED(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/candidaturas/colocados?" +
            "ano_lectivo={year}&institui%E7%E3o={institution}&fase={phase}&curso={course}"),
    CLASS_ENROLLED(Method.GET, Shape.TEXT,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/actividade/inscri%E7%F5es/pautas?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}" +
            "&modo=pauta&aux=ficheiro"),
    CLASS_RESULTS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/actividade/resultados/pautas?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}" +
            "&tipo_de_avalia%E7%E3o_curricular=a"),
    CLASS_FILE_TYPES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/sector/ano_lectivo/unidade_curricular/actividade/documentos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_FILES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/sector/ano_lectivo/unidade_curricular/actividade/documentos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}" +
            "&tipo_de_documento_de_unidade={file_type}"),
    /**
     * Bilingual class information sections. All share one page layout.
     */
    CLASS_DESCRIPTION(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/descri%E7%E3o?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_OBJECTIVES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/objectivos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_REQUIREMENTS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/requisitos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_COMPETENCES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/compet%EAncias?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_PROGRAM(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/programa?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_BIBLIOGRAPHY(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/caracteriza%E7%E3o/bibliografia?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_TEACHING_METHODS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/funcionamento/m%E9todos_de_ensino?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_EVALUATION_METHODS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/funcionamento/m%E9todos_de_avalia%E7%E3o?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_ASSISTANCE(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/organiza%E7%E3o/calend%E1rio/atendimento?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_EVENTS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/organiza%E7%E3o/calend%E1rio/eventos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_SUMMARIES(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/actividade/sum%E1rios?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    /**
     * Shift list of a class instance. A class with a single shift answers with that shift's page.
     */
    CLASS_SHIFTS(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/actividade/turnos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}"),
    CLASS_SHIFT(Method.GET, Shape.HTML,
            "/utente/institui%E7%E3o_sede/unidade_organica/ensino/ano_lectivo/sector/ano_lectivo/unidade_curricular/actividade/turnos?" +
            "tipo_de_per%EDodo_lectivo={period_type}&sector={department}&ano_lectivo={year}" +
            "&per%EDodo_lectivo={period}&institui%E7%E3o={institution}&unidade_curricular={class}" +
            "&tipo={shift_type}&n%BA={shift}"),
    FILE_DOWNLOAD(Method.GET, Shape.BINARY, "/objecto?oid={file}"),
    /**
     * Library study room availability. Only answers to a form submission, the date goes in the body.
     */
    LIBRARY_ROOMS(Method.POST, Shape.HTML, "/utente/biblioteca/reservas/salas");

    private final Method method;
    private final Shape shape;
    private final String template;
    private final List<String> pathParameters;

    PageKind(Method method, Shape shape, String template) {
        this.method = method;
        this.shape = shape;
        this.template = template;
        List<String> names = new ArrayList<>();
        Matcher matcher = Placeholders.PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        this.pathParameters = Collections.unmodifiableList(names);
    }

    public Method method() {
        return method;
    }

    public Shape shape() {
        return shape;
    }

    /**
     * Names of the parameters substituted into the request path. For POST pages any other parameter
     * is sent as a form field.
     */
    public List<String> pathParameters() {
        return pathParameters;
    }

    String expand(Map<String, String> params) {
        Matcher matcher = Placeholders.PATTERN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = params.get(matcher.group(1));
            if (value == null) {
                throw new IllegalArgumentException(name() + " requires parameter " + matcher.group(1));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(encode(value)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, ISO_8859_1);
    }

    // Enum constructors may not read the enum's own static fields.
    private static class Placeholders {
        static final Pattern PATTERN = Pattern.compile("\\{(\\w+)}");
    }

    public enum Method {
        GET, POST
    }

    /**
     * What a successful response body is expected to look like.
     */
    public enum Shape {
        HTML, TEXT, BINARY
    }
}
