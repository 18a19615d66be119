package at.sv.daylight;

/**
 * Exception to signal that a civil date or instant could not be resolved into calendar components, e.g. an invalid
 * day of month or an instant outside the supported date range. This is a precondition violation of the caller.
 */
public final class InvalidCalendarComponentsException extends RuntimeException {

    public InvalidCalendarComponentsException(String message) {
        super(message);
    }

    public InvalidCalendarComponentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
