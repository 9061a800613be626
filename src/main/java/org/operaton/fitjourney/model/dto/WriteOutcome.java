package org.operaton.fitjourney.model.dto;

import java.util.List;

/**
 * Result of a write whose primary effect committed.
 * Secondary effects that failed afterwards are listed in {@code secondaryFailures}.
 *
 * @param value             the primary result, e.g. the new workout id
 * @param secondaryFailures failed follow-up steps, empty on full success
 */
public record WriteOutcome<T>(T value, List<SecondaryFailure> secondaryFailures) {

    public WriteOutcome {
        secondaryFailures = List.copyOf(secondaryFailures);
    }

    public static <T> WriteOutcome<T> success(T value) {
        return new WriteOutcome<>(value, List.of());
    }

    public boolean isFullSuccess() {
        return secondaryFailures.isEmpty();
    }

    public boolean hasFailed(String step) {
        return secondaryFailures.stream().anyMatch(f -> f.step().equals(step));
    }

    /**
     * A follow-up step that failed after the primary write committed.
     */
    public record SecondaryFailure(String step, String message) {
    }
}
