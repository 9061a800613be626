package org.operaton.fitjourney.exception;

/**
 * Exception thrown when a per-user operation runs without a resolved user id.
 */
public class NotLoggedInException extends FitJourneyException {

    public NotLoggedInException() {
        super("User not logged in");
    }

    public NotLoggedInException(String message) {
        super(message);
    }
}
