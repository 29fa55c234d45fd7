package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.RawPage;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Library study room availability for one day. Each row is a room followed by its time slots.
 */
final class LibraryPages {
    static final String DATE_PARAM = "data";

    private LibraryPages() {
    }

    static ParseResult rooms(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        String date = target.param(DATE_PARAM);
        Element header = null;
        for (Element th : Links.html(page).select("th")) {
            if (th.text().strip().equals("Sala")) {
                header = th;
                break;
            }
        }
        Element table = header == null ? null : header.closest("table");
        if (table == null) {
            throw new ParseException(EntityKind.LIBRARY_ROOM_STATUS, target.kind(), "availability table not found");
        }
        var result = ParseResult.builder();
        for (Element row : table.select("tr")) {
            Elements cells = row.select("> td");
            if (cells.size() < 2) continue;
            String room = Text.blankToNull(cells.get(0).text());
            if (room == null) continue;
            int free = 0;
            for (int i = 1; i < cells.size(); i++) {
                Element slot = cells.get(i);
                if (slot.hasClass("livre") || slot.text().strip().equalsIgnoreCase("Livre")) free++;
            }
            result.record(StructuredRecord.builder(Keys.libraryRoom(date, room))
                    .field("room", room)
                    .field("date", date)
                    .authoritativeField("free_slots", free)
                    .authoritativeField("total_slots", cells.size() - 1)
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }
}
