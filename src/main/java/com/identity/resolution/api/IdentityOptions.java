package com.identity.resolution.api;

import com.identity.resolution.platform.GetentAccountDatabase;
import com.identity.resolution.platform.PasswdFileAccountDatabase;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Options for current-user resolution.
 * Configures the fallback environment variable and the system lookup.
 */
public class IdentityOptions {

    private static final String DEFAULT_FALLBACK_VARIABLE = "USERNAME";

    private final String fallbackVariable;
    private final Duration lookupTimeout;
    private final Path passwdFile;

    private IdentityOptions(Builder builder) {
        this.fallbackVariable = builder.fallbackVariable;
        this.lookupTimeout = builder.lookupTimeout;
        this.passwdFile = builder.passwdFile;
    }

    /**
     * Environment variable read when the system lookup yields no name.
     */
    public String getFallbackVariable() {
        return fallbackVariable;
    }

    public Duration getLookupTimeout() {
        return lookupTimeout;
    }

    public Path getPasswdFile() {
        return passwdFile;
    }

    /**
     * Creates default options.
     */
    public static IdentityOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String fallbackVariable = DEFAULT_FALLBACK_VARIABLE;
        private Duration lookupTimeout = GetentAccountDatabase.DEFAULT_TIMEOUT;
        private Path passwdFile = PasswdFileAccountDatabase.DEFAULT_PASSWD_FILE;

        public Builder fallbackVariable(String fallbackVariable) {
            this.fallbackVariable = fallbackVariable;
            return this;
        }

        public Builder lookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = lookupTimeout;
            return this;
        }

        public Builder passwdFile(Path passwdFile) {
            this.passwdFile = passwdFile;
            return this;
        }

        public IdentityOptions build() {
            if (fallbackVariable == null || fallbackVariable.isBlank()) {
                throw new IllegalArgumentException("fallbackVariable must not be blank");
            }
            Objects.requireNonNull(lookupTimeout, "lookupTimeout must not be null");
            if (lookupTimeout.isNegative() || lookupTimeout.isZero()) {
                throw new IllegalArgumentException("lookupTimeout must be > 0");
            }
            Objects.requireNonNull(passwdFile, "passwdFile must not be null");
            return new IdentityOptions(this);
        }
    }
}
