package io.poolermanager.models;

/**
 * Cluster phases written by the pooler manager. The stored value is the human readable one.
 */
public enum ClusterPhase {
    SWITCHOVER("Switchover in progress");

    private final String value;

    ClusterPhase(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
