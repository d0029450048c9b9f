package com.identity.resolution.platform;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of mapping a uid to an account name.
 * A lookup either finds a name, finds nothing, or fails outright.
 *
 * @param outcome the lookup outcome
 * @param name    the account name, present only for {@link Outcome#FOUND}
 * @param failure the cause, present only for {@link Outcome#FAILED}
 */
public record LookupResult(Outcome outcome, String name, Throwable failure) {

    public enum Outcome { FOUND, NOT_FOUND, FAILED }

    public LookupResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (outcome == Outcome.FOUND && (name == null || name.isBlank())) {
            throw new IllegalArgumentException("FOUND result requires a non-blank name");
        }
    }

    public static LookupResult found(String name) {
        return new LookupResult(Outcome.FOUND, name, null);
    }

    public static LookupResult notFound() {
        return new LookupResult(Outcome.NOT_FOUND, null, null);
    }

    public static LookupResult failed(Throwable cause) {
        return new LookupResult(Outcome.FAILED, null, cause);
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    /**
     * Returns the account name when found.
     */
    public Optional<String> nameIfFound() {
        return isFound() ? Optional.of(name) : Optional.empty();
    }
}
