package org.clipcrawl.portal;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Instant;
import java.util.Locale;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * A fetched page, handed from the dispatcher to a parser.
 *
 * @param target      what was fetched
 * @param content     response body
 * @param fetchedAt   when the response was received
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header, if any
 */
public record RawPage(CrawlTarget target, byte[] content, Instant fetchedAt, int status,
                      @Nullable String contentType) {

    /**
     * Decodes the body using the charset named in the Content-Type header. The portal serves Latin-1
     * and often doesn't say so, which is the fallback.
     */
    public String text() {
        return new String(content, charset());
    }

    public Charset charset() {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                part = part.trim();
                if (part.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                    String name = part.substring("charset=".length()).replace("\"", "").trim();
                    try {
                        return Charset.forName(name);
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        return ISO_8859_1;
                    }
                }
            }
        }
        return ISO_8859_1;
    }

    public @Nullable String mediaType() {
        if (contentType == null) return null;
        int i = contentType.indexOf(';');
        return (i < 0 ? contentType : contentType.substring(0, i)).trim().toLowerCase(Locale.ROOT);
    }
}
