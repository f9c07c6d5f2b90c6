package io.github.riemr.attendance.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaymentType {
    FULL_PAY,
    HALF_PAY,
    UNPAID;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PaymentType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return PaymentType.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
