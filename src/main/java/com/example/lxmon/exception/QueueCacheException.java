package com.example.lxmon.exception;

/**
 * Raised when the queue/cache backend cannot be reached or rejects an operation.
 */
public class QueueCacheException extends RuntimeException {

    public QueueCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
