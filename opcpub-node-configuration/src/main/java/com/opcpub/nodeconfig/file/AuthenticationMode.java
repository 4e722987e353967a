package com.opcpub.nodeconfig.file;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the gateway authenticates its session to an endpoint. JSON uses {@code Anonymous},
 * {@code UsernamePassword} and {@code Certificate}; files written by older publishers may carry the
 * ordinal (0, 1, 2) instead. A missing value means {@link #ANONYMOUS}.
 */
public enum AuthenticationMode {
    ANONYMOUS("Anonymous"),
    /** Requires an {@link EncryptedCredential}. */
    USERNAME_PASSWORD("UsernamePassword"),
    CERTIFICATE("Certificate");

    private final String value;

    AuthenticationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    public boolean requiresCredential() {
        return this == USERNAME_PASSWORD;
    }

    @JsonCreator
    public static AuthenticationMode fromValue(String value) {
        if (value == null || value.isBlank()) return ANONYMOUS;
        String normalized = value.trim();
        for (AuthenticationMode m : values()) {
            if (m.value.equalsIgnoreCase(normalized) || m.name().equalsIgnoreCase(normalized)
                    || String.valueOf(m.ordinal()).equals(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown authentication mode: " + value);
    }
}
