package org.operaton.fitjourney.exception;

/**
 * Exception thrown when a request is rejected before any write, e.g. an
 * ExerciseTarget goal without an exercise or a set with a non-positive set number.
 */
public class ValidationException extends FitJourneyException {

    public ValidationException(String message) {
        super(message);
    }
}
