package org.clipcrawl.parse;

import org.clipcrawl.portal.CrawlTarget;
import org.jetbrains.annotations.Nullable;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

final class Text {
    private static final List<String> WEEKDAYS = List.of("segunda", "terça", "quarta", "quinta", "sexta", "sábado",
            "domingo");

    private Text() {
    }

    static int year(CrawlTarget target) {
        return Integer.parseInt(target.param("year"));
    }

    /**
     * Reads an integer cell, allowing ordinal suffixes like {@code 2º}. Unreadable values are unknown,
     * not zero.
     */
    static @Nullable Integer integer(@Nullable String text) {
        if (text == null) return null;
        String s = text.strip();
        while (!s.isEmpty() && (s.endsWith("º") || s.endsWith("ª"))) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.isEmpty()) return null;
        try {
            return Integer.valueOf(s.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static @Nullable String blankToNull(@Nullable String text) {
        if (text == null) return null;
        String s = text.strip();
        return s.isEmpty() ? null : s;
    }

    /**
     * Compatibility normalisation, so non-breaking spaces and the like compare as plain text.
     */
    static String normalize(String text) {
        return Normalizer.normalize(text, Normalizer.Form.NFKC).strip();
    }

    /**
     * Minutes since midnight of an {@code HH:MM} time, or the length of an {@code HH:MM} duration.
     */
    static int minutes(String time) {
        String[] parts = time.strip().split(":");
        if (parts.length != 2) throw new IllegalArgumentException("not a time: " + time);
        return Integer.parseInt(parts[0]) * 60 + Integer.parseInt(parts[1]);
    }

    /**
     * Weekday number from Monday (0) for names like {@code Segunda-Feira} or {@code Sábado}.
     */
    static @Nullable Integer weekday(String name) {
        String simple = name.strip().split("-")[0].toLowerCase(Locale.ROOT).replace("sabado", "sábado");
        if (simple.isEmpty()) return null;
        for (int i = 0; i < WEEKDAYS.size(); i++) {
            if (WEEKDAYS.get(i).startsWith(simple)) return i;
        }
        return null;
    }
}
