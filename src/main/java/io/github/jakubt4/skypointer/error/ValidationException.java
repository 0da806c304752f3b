package io.github.jakubt4.skypointer.error;

/**
 * Rejected caller input: malformed or out-of-calendar date/time, bad step size,
 * observer coordinates outside their range.
 */
public class ValidationException extends PositionException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
