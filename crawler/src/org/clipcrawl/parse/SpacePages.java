package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.RoomType;
import org.clipcrawl.model.StructuredRecord;
import org.clipcrawl.parse.Links.Link;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.clipcrawl.portal.RawPage;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Buildings and the rooms listed in their occupation schedules.
 */
final class SpacePages {
    /**
     * Weekday numbers the occupation schedule accepts, Monday to Friday.
     */
    static final List<String> WEEKDAYS = List.of("2", "3", "4", "5", "6");

    /**
     * Long room names look like {@code Laboratório de Ensino Ed 2: Lab 123}.
     */
    private static final Pattern LONG_ROOM = Pattern.compile(
            "(?<type>Sala|Laboratório de Ensino|Anfiteatro)" +
            "( de (?<subtype>Aula|Reunião|Mestrado|Computadores|Multimédia|Multiusos))?" +
            "( Ed (?<building>[\\w ]+):)? (Lab[.]? |Laboratório )?(?<name>[\\w .-]*)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private SpacePages() {
    }

    static ParseResult buildings(RawPage page) throws ParseException {
        CrawlTarget target = page.target();
        List<Link> links = Links.distinct(Links.html(page), Links.BUILDING);
        if (links.isEmpty()) {
            throw new ParseException(EntityKind.PHYSICAL_SPACE, target.kind(), "no building links");
        }
        int year = Text.year(target);
        var result = ParseResult.builder();
        for (Link link : links) {
            result.record(StructuredRecord.builder(Keys.building(link.id()))
                    .authoritativeField("name", link.text())
                    .field("space", "building")
                    .seenIn(year)
                    .source(target.kind(), page.fetchedAt())
                    .build());
            for (String weekday : WEEKDAYS) {
                result.discover(target.child(PageKind.BUILDING_SCHEDULE, "building", link.id(), "weekday", weekday));
            }
        }
        return result.build();
    }

    static ParseResult rooms(RawPage page) {
        CrawlTarget target = page.target();
        int year = Text.year(target);
        var result = ParseResult.builder();
        for (Link link : Links.distinct(Links.html(page), Links.ROOM)) {
            RoomName room = classify(link.text());
            result.record(StructuredRecord.builder(Keys.room(link.id()))
                    .authoritativeField("name", room.name())
                    .authoritativeField("room_type", room.type().name())
                    .field("space", "room")
                    .seenIn(year)
                    .reference("building", Keys.building(target.param("building")))
                    .source(target.kind(), page.fetchedAt())
                    .build());
        }
        return result.build();
    }

    /**
     * Splits a long room name into its type and short name. Names that don't follow the usual pattern
     * are kept whole as generic rooms.
     */
    static RoomName classify(String longName) {
        Matcher matcher = LONG_ROOM.matcher(longName);
        if (!matcher.find()) return new RoomName(RoomType.GENERIC, longName.strip());
        String name = matcher.group("name").strip();
        if (name.isEmpty()) name = longName.strip();
        String subtype = matcher.group("subtype");
        if (subtype != null) {
            RoomType type = switch (subtype) {
                case "Aula" -> RoomType.CLASSROOM;
                case "Computadores" -> RoomType.COMPUTER;
                case "Reunião" -> RoomType.MEETING_ROOM;
                case "Mestrado", "Multimédia" -> RoomType.MASTERS;
                default -> RoomType.GENERIC;
            };
            return new RoomName(type, name);
        }
        String type = matcher.group("type");
        if (type.startsWith("Lab")) return new RoomName(RoomType.LABORATORY, name);
        if (type.startsWith("Anf")) return new RoomName(RoomType.AUDITORIUM, name);
        return new RoomName(RoomType.GENERIC, name);
    }

    record RoomName(RoomType type, String name) {
    }
}
