package io.github.riemr.attendance.domain.model;

import java.util.Locale;

/**
 * Review state shared by leave requests and attendance exceptions.
 */
public enum RequestStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RequestStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return RequestStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
