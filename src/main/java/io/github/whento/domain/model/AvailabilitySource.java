package io.github.whento.domain.model;

public enum AvailabilitySource {
    MANUAL("manual"),
    RECURRING("recurrence");

    private final String value;

    AvailabilitySource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AvailabilitySource fromValue(String value) {
        for (AvailabilitySource s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        return MANUAL;
    }
}
