package com.identity.resolution.env;

import java.util.Map;

/**
 * Read-only view of process environment variables.
 */
@FunctionalInterface
public interface EnvironmentSource {

    /**
     * Returns the value of the variable, or null if unset.
     */
    String get(String name);

    /**
     * The real process environment.
     */
    static EnvironmentSource system() {
        return System::getenv;
    }

    /**
     * A fixed environment, mainly for tests.
     */
    static EnvironmentSource of(Map<String, String> variables) {
        Map<String, String> copy = Map.copyOf(variables);
        return copy::get;
    }
}
