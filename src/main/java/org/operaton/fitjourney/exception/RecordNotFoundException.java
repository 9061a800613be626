package org.operaton.fitjourney.exception;

/**
 * Exception thrown when a mutating operation targets a record that does not exist.
 * Read paths return {@link java.util.Optional#empty()} instead.
 */
public class RecordNotFoundException extends FitJourneyException {

    public RecordNotFoundException(String table, Object id) {
        super("No " + table + " record with id " + id);
    }
}
