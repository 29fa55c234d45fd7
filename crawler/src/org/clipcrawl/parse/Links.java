package org.clipcrawl.parse;

import org.clipcrawl.portal.RawPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Link patterns of the portal's navigation. The portal's hrefs keep their Latin-1 percent escapes,
 * so patterns match the escaped form.
 */
final class Links {
    static final Pattern DEPARTMENT = Pattern.compile("\\bsector=(\\d+)\\b");
    static final Pattern COURSE = Pattern.compile("\\bcurso=(\\d+)\\b");
    static final Pattern TEACHER = Pattern.compile("\\bdocente=(\\d+)\\b");
    static final Pattern CLASS = Pattern.compile("\\bunidade_curricular=(\\d+)\\b");
    static final Pattern BUILDING = Pattern.compile("\\bedif%EDcio=(\\d+)\\b");
    static final Pattern ROOM = Pattern.compile("\\bespa%E7o=(\\d+)\\b");
    static final Pattern YEAR = Pattern.compile("\\bano_lectivo=(\\d+)\\b");
    static final Pattern PERIOD_TYPE = Pattern.compile("\\btipo_de_per%EDodo_lectivo=(\\w)\\b");
    static final Pattern PERIOD = Pattern.compile("\\bper%EDodo_lectivo=(\\d)\\b");
    static final Pattern FILE_TYPE = Pattern.compile("\\btipo_de_documento_de_unidade=(\\w+)\\b");
    /**
     * Shift links carry the shift type then its number, e.g. {@code &tipo=T&n%BA=2}.
     */
    static final Pattern SHIFT = Pattern.compile("&tipo=(\\w+)&n%BA=(\\d+)\\b");
    static final Pattern FILE = Pattern.compile("\\boid=(\\d+)&oin=(.+)");

    private Links() {
    }

    static Document html(RawPage page) {
        return Jsoup.parse(page.text());
    }

    /**
     * Every link under root whose href matches the pattern, in document order.
     */
    static List<Link> find(Element root, Pattern pattern) {
        List<Link> links = new ArrayList<>();
        for (Element a : root.select("a[href]")) {
            Matcher matcher = pattern.matcher(a.attr("href"));
            if (matcher.find()) {
                links.add(new Link(a, matcher.toMatchResult()));
            }
        }
        return links;
    }

    /**
     * Like {@link #find} but keeps only the first link for each distinct id.
     */
    static List<Link> distinct(Element root, Pattern pattern) {
        Map<String, Link> byId = new LinkedHashMap<>();
        for (Link link : find(root, pattern)) {
            byId.putIfAbsent(link.id(), link);
        }
        return new ArrayList<>(byId.values());
    }

    static String firstGroup(Pattern pattern, String href) {
        Matcher matcher = pattern.matcher(href);
        return matcher.find() ? matcher.group(1) : null;
    }

    record Link(Element element, MatchResult match) {
        String id() {
            return match.group(1);
        }

        String text() {
            return element.text().strip();
        }

        String href() {
            return element.attr("href");
        }
    }
}
