package io.github.riemr.attendance.domain.model;

/**
 * Leave types the labour rules know about, keyed by the name stored in leave_types.
 */
public enum LeaveCategory {
    ANNUAL("Annual Leave"),
    SICK("Sick Leave"),
    MATERNITY("Maternity Leave"),
    PARENTAL("Parental Leave"),
    COMPASSIONATE("Compassionate Leave"),
    STUDY("Study Leave"),
    HAJJ("Hajj Leave"),
    OTHER(null);

    private final String displayName;

    LeaveCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Compassionate leave is granted per event and never pre-allocated. */
    public boolean isAutoAllocated() {
        return this != COMPASSIONATE && this != OTHER;
    }

    public static LeaveCategory fromName(String name) {
        if (name == null || name.isBlank()) return OTHER;
        String trimmed = name.trim();
        for (LeaveCategory c : values()) {
            if (c.displayName != null && c.displayName.equalsIgnoreCase(trimmed)) {
                return c;
            }
        }
        return OTHER;
    }
}
