package org.clipcrawl.model;

public enum EntityKind {
    STUDENT,
    TEACHER,
    CLASS,
    /**
     * A student's enrolment in one class instance (class, year and period).
     */
    ENROLLMENT,
    /**
     * One class in one year and period. Carries the bilingual information sections.
     */
    CLASS_INSTANCE,
    SHIFT,
    /**
     * A student's place in a shift.
     */
    SHIFT_ENROLLMENT,
    CLASS_EVENT,
    CLASS_SUMMARY,
    DEPARTMENT,
    COURSE,
    /**
     * Buildings and rooms. Keys are {@code building/ID} or {@code room/ID}.
     */
    PHYSICAL_SPACE,
    ADMISSION_RECORD,
    LIBRARY_ROOM_STATUS,
    FILE_ATTACHMENT
}
