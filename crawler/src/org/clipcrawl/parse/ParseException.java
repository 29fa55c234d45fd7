package org.clipcrawl.parse;

import org.clipcrawl.model.EntityKind;
import org.clipcrawl.portal.PageKind;
import org.jetbrains.annotations.Nullable;

/**
 * A page didn't have the structure its parser requires. Never fatal to a pass: the target is marked
 * failed and may be retried on a later pass.
 */
public class ParseException extends Exception {
    private final @Nullable EntityKind entityKind;
    private final PageKind pageKind;

    public ParseException(@Nullable EntityKind entityKind, PageKind pageKind, String reason) {
        super(pageKind + (entityKind == null ? "" : " (" + entityKind + ")") + ": " + reason);
        this.entityKind = entityKind;
        this.pageKind = pageKind;
    }

    public ParseException(@Nullable EntityKind entityKind, PageKind pageKind, String reason, Throwable cause) {
        this(entityKind, pageKind, reason);
        initCause(cause);
    }

    public @Nullable EntityKind entityKind() {
        return entityKind;
    }

    public PageKind pageKind() {
        return pageKind;
    }
}
