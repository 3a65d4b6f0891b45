package org.ohnlp.cdm.timeline.exceptions;

/**
 * Root of all failures raised while building a timeline.
 */
public class TimelineException extends RuntimeException {
    public TimelineException(String message) {
        super(message);
    }

    public TimelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
