package io.github.riemr.attendance.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BreachType {
    CONSECUTIVE,
    MONTHLY;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
