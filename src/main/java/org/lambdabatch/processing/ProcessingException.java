package org.lambdabatch.processing;

/**
 * A single image could not be turned into its artifacts. Contained to that image.
 */
public class ProcessingException extends Exception {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
