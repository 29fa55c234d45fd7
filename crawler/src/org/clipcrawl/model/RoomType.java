package org.clipcrawl.model;

public enum RoomType {
    GENERIC,
    CLASSROOM,
    AUDITORIUM,
    LABORATORY,
    COMPUTER,
    MEETING_ROOM,
    MASTERS
}
