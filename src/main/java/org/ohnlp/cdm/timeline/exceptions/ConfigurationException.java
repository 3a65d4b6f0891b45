package org.ohnlp.cdm.timeline.exceptions;

public class ConfigurationException extends TimelineException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
