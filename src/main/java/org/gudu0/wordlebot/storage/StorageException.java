package org.gudu0.wordlebot.storage;

/**
 * The results database could not be reached or a statement failed.
 * Thrown to callers as-is; the store never retries.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
