package io.github.riemr.attendance.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DayStatusKind {
    OK("ok"),
    PENDING_EXCEPTION("pending-exception"),
    ISSUES_NO_EXCEPTION("issues-no-exception"),
    LEAVE("leave"),
    FUTURE("future"),
    NON_WORKING("non-working"),
    ABSENT("absent");

    private final String code;

    DayStatusKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
