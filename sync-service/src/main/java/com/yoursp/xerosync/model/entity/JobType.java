package com.yoursp.xerosync.model.entity;

import java.util.Arrays;

/**
 * Category of recurring tenant work. Persisted as its lowercase value.
 */
public enum JobType {

    INVOICE("invoice"),
    STATEMENT("statement");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** "Invoice", "Statement" */
    public String displayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    public static JobType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + value));
    }
}
