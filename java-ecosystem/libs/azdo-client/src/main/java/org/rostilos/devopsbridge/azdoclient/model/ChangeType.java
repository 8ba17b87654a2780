package org.rostilos.devopsbridge.azdoclient.model;

import java.util.Locale;

public enum ChangeType {
    ADD("add"),
    EDIT("edit");

    private final String wireValue;

    ChangeType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static ChangeType fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return EDIT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ChangeType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported change type: " + value);
    }
}
