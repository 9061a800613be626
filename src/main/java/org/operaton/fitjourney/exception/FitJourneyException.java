package org.operaton.fitjourney.exception;

/**
 * Base class for all domain errors raised by the FitJourney core.
 */
public class FitJourneyException extends RuntimeException {

    public FitJourneyException(String message) {
        super(message);
    }

    public FitJourneyException(String message, Throwable cause) {
        super(message, cause);
    }
}
