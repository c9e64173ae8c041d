package org.carball.planlens.output;

/**
 * Thrown when an inspection report cannot be serialized.
 */
public class ReportWriteException extends RuntimeException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
