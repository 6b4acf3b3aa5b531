package com.anthem.dataproc.auth.model;

/**
 * IAM statement effect.
 */
public enum Effect {
    ALLOW("Allow"),
    DENY("Deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
