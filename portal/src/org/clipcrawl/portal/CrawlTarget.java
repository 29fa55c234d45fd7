package org.clipcrawl.portal;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A page to be fetched: its kind and the parameters that identify it, plus the key of the target
 * it was discovered from.
 *
 * @param kind   the page kind
 * @param params parameters, kept sorted by name so that equal targets have equal keys
 * @param via    key of the target whose page linked here, null for seeds
 */
public record CrawlTarget(@NotNull PageKind kind, @NotNull Map<String, String> params, @Nullable String via) {
    public CrawlTarget {
        Objects.requireNonNull(kind, "kind");
        params = Collections.unmodifiableMap(new TreeMap<>(params));
    }

    /**
     * Builds a target from alternating parameter names and values.
     */
    public static CrawlTarget of(PageKind kind, String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) throw new IllegalArgumentException("odd number of arguments");
        var params = new TreeMap<String, String>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            params.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return new CrawlTarget(kind, params, null);
    }

    /**
     * Parses a key produced by {@link #key()}.
     */
    public static CrawlTarget fromKey(String key, @Nullable String via) {
        int i = key.indexOf('?');
        PageKind kind = PageKind.valueOf(i < 0 ? key : key.substring(0, i));
        var params = new TreeMap<String, String>();
        if (i >= 0 && i + 1 < key.length()) {
            for (String pair : key.substring(i + 1).split("&")) {
                int eq = pair.indexOf('=');
                if (eq < 0) throw new IllegalArgumentException("Malformed target key: " + key);
                params.put(URLDecoder.decode(pair.substring(0, eq), UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), UTF_8));
            }
        }
        return new CrawlTarget(kind, params, via);
    }

    /**
     * Canonical identity of this target. Two targets with the same key fetch the same page.
     */
    public String key() {
        if (params.isEmpty()) return kind.name();
        var joiner = new StringJoiner("&", kind.name() + "?", "");
        params.forEach((name, value) -> joiner.add(URLEncoder.encode(name, UTF_8) + "=" + URLEncoder.encode(value, UTF_8)));
        return joiner.toString();
    }

    public String param(String name) {
        String value = params.get(name);
        if (value == null) throw new IllegalArgumentException(kind + " target has no parameter " + name);
        return value;
    }

    public @Nullable String paramOrNull(String name) {
        return params.get(name);
    }

    /**
     * Derives a target of another kind, inheriting this target's parameters (overridden by the given
     * ones) and recording this target as the one it was discovered from.
     */
    public CrawlTarget child(PageKind childKind, String... namesAndValues) {
        var childParams = new TreeMap<>(params);
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            childParams.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        if (childKind.method() == PageKind.Method.GET) {
            childParams.keySet().retainAll(childKind.pathParameters());
        }
        return new CrawlTarget(childKind, childParams, key());
    }

    public CrawlTarget withVia(@Nullable String via) {
        return new CrawlTarget(kind, params, via);
    }

    public URI uri(URI baseUri) {
        String base = baseUri.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base + kind.expand(params));
    }

    /**
     * The form body for POST pages: every parameter that is not part of the path.
     */
    public String formData() {
        var joiner = new StringJoiner("&");
        params.forEach((name, value) -> {
            if (!kind.pathParameters().contains(name)) {
                joiner.add(PageKind.encode(name) + "=" + PageKind.encode(value));
            }
        });
        return joiner.toString();
    }

    @Override
    public String toString() {
        return key();
    }
}
