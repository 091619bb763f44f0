package com.vbwd.plugin.core.store;

/**
 * Status values kept by the plugin state store. Only enable/disable decisions survive a restart.
 */
public enum PersistedStatus {
    ENABLED("enabled"),
    DISABLED("disabled");

    private final String wireValue;

    PersistedStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Value written to durable storage ("enabled" / "disabled"). */
    public String getWireValue() {
        return wireValue;
    }

    public static PersistedStatus fromWireValue(String value) {
        if (value != null) {
            String v = value.trim();
            for (PersistedStatus s : values()) {
                if (s.wireValue.equalsIgnoreCase(v)) return s;
            }
        }
        throw new IllegalArgumentException("Unknown persisted plugin status: " + value);
    }
}
