package com.safar.bot.exception;

/**
 * Storage was unreachable, timed out or lost an optimistic-lock race. The event can be retried.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
