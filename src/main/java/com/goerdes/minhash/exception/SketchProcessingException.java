package com.goerdes.minhash.exception;

/**
 * Thrown when the application layer cannot complete a sketch related task,
 * e.g. writing an evaluation report.
 */
public class SketchProcessingException extends RuntimeException {

    public SketchProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
