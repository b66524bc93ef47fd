package io.github.whento.domain.model;

import java.util.Locale;

public enum HolidaysPolicy {
    IGNORE("ignore"),
    ALLOW("allow"),
    BLOCK("block");

    private final String value;

    HolidaysPolicy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Unknown or missing values fall back to IGNORE, the column default. */
    public static HolidaysPolicy fromValue(String value) {
        if (value == null || value.isBlank()) return IGNORE;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (HolidaysPolicy p : values()) {
            if (p.value.equals(v)) return p;
        }
        return IGNORE;
    }
}
