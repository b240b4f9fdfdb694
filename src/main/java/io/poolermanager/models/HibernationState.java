package io.poolermanager.models;

/**
 * Values of the hibernation annotation. An absent annotation means the cluster is not
 * hibernated.
 */
public enum HibernationState {
    ON("on"),
    OFF("off");

    private final String value;

    HibernationState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HibernationState fromString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (HibernationState state : values()) {
            if (state.value.equalsIgnoreCase(trimmed)) {
                return state;
            }
        }
        return null;
    }
}
