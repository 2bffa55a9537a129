package com.lawgraph.draftimpact.exception;

/**
 * Thrown when a regulation library, or one of its documents, cannot be opened.
 */
public class LibraryUnavailableException extends RuntimeException {

    public LibraryUnavailableException(String message) {
        super(message);
    }

    public LibraryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
