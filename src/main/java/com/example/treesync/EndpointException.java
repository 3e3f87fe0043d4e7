package com.example.treesync;

/**
 * A root endpoint is missing, is not a directory, or could not be created. Fatal for the run.
 */
public class EndpointException extends Exception {
    public EndpointException(String message) {
        super(message);
    }

    public EndpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
