package com.identity.resolution.env;

import java.util.Locale;
import java.util.Optional;

/**
 * Deployment tier a process runs in.
 */
public enum DeploymentEnvironment {
    PROD,
    TEST,
    DEV;

    /**
     * Parses a tier name case-insensitively.
     */
    public static Optional<DeploymentEnvironment> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Lowercase name as used in environment variables and host names.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
