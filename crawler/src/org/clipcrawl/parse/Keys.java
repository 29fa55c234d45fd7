package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.model.NaturalKey;
import org.clipcrawl.portal.CrawlTarget;
import org.jetbrains.annotations.Nullable;

/**
 * Natural keys of portal entities. Entities seen on different pages must get equal keys here or
 * they won't be merged.
 */
public final class Keys {
    private Keys() {
    }

    public static NaturalKey department(String id) {
        return new NaturalKey(EntityKind.DEPARTMENT, id);
    }

    public static NaturalKey teacher(String id) {
        return new NaturalKey(EntityKind.TEACHER, id);
    }

    public static NaturalKey course(String id) {
        return new NaturalKey(EntityKind.COURSE, id);
    }

    public static NaturalKey student(String id) {
        return new NaturalKey(EntityKind.STUDENT, id);
    }

    public static NaturalKey building(String id) {
        return NaturalKey.of(EntityKind.PHYSICAL_SPACE, "building/", id);
    }

    public static NaturalKey room(String id) {
        return NaturalKey.of(EntityKind.PHYSICAL_SPACE, "room/", id);
    }

    public static NaturalKey file(String id) {
        return new NaturalKey(EntityKind.FILE_ATTACHMENT, id);
    }

    /**
     * A class (curricular unit) within its department, from any target carrying both.
     */
    public static NaturalKey classOf(CrawlTarget target) {
        return NaturalKey.of(EntityKind.CLASS, target.param("department"), ":", target.param("class"));
    }

    /**
     * The class instance identified by the target's class, year and period.
     */
    public static NaturalKey classInstance(CrawlTarget target) {
        return new NaturalKey(EntityKind.CLASS_INSTANCE, instance(target));
    }

    public static NaturalKey enrollment(String studentId, CrawlTarget target) {
        return NaturalKey.of(EntityKind.ENROLLMENT, studentId, "@", instance(target));
    }

    public static NaturalKey shift(CrawlTarget target, String type, int number) {
        return NaturalKey.of(EntityKind.SHIFT, instance(target), "/", type, number);
    }

    public static NaturalKey shiftEnrollment(String studentId, NaturalKey shift) {
        return NaturalKey.of(EntityKind.SHIFT_ENROLLMENT, studentId, "@", shift.value());
    }

    public static NaturalKey classEvent(CrawlTarget target, String date, @Nullable Integer start, String type) {
        return NaturalKey.of(EntityKind.CLASS_EVENT, instance(target), "/", date, "/", start == null ? "" : start,
                "/", type);
    }

    public static NaturalKey classSummary(CrawlTarget target, String shift, String start) {
        return NaturalKey.of(EntityKind.CLASS_SUMMARY, instance(target), "/", shift, "/", start);
    }

    private static String instance(CrawlTarget target) {
        return target.param("department") + ":" + target.param("class") + "/" + target.param("year") + "/"
               + target.param("period_type") + target.param("period");
    }

    public static NaturalKey admission(CrawlTarget target, String applicant) {
        return NaturalKey.of(EntityKind.ADMISSION_RECORD, target.param("year"), ":", target.param("phase"), ":",
                target.param("course"), ":", applicant);
    }

    public static NaturalKey libraryRoom(String date, String room) {
        return NaturalKey.of(EntityKind.LIBRARY_ROOM_STATUS, date, "/", room);
    }
}
