package io.github.jakubt4.skypointer.error;

/**
 * Base type for local failures of a position query. None of them are fatal;
 * callers decide how to report or retry.
 */
public abstract class PositionException extends RuntimeException {

    protected PositionException(final String message) {
        super(message);
    }

    protected PositionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
