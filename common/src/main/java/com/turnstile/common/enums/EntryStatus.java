package com.turnstile.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryStatus {
    IN("in"),
    OUT("out");

    private final String value;

    EntryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isInside() {
        return this == IN;
    }

    @JsonCreator
    public static EntryStatus fromValue(String value) {
        for (EntryStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown entry status: " + value);
    }
}
