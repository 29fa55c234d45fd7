package org.clipcrawl.parse;

import org.clipcrawl.portal.RawPage;

/**
 * Converts one kind of portal page into records and further targets. Implementations are pure and
 * must not fabricate values: an optional field that can't be read is left out, while a missing
 * structural anchor fails the whole page.
 */
@FunctionalInterface
public interface PageParser {
    ParseResult parse(RawPage page) throws ParseException;
}
