package com.example.lxmon.exception;

/**
 * The command text violates the configured command policy and was not queued.
 */
public class CommandRejectedException extends RuntimeException {

    public CommandRejectedException(String message) {
        super(message);
    }
}
