package org.ohnlp.cdm.timeline.exceptions;

public class VocabularyMappingException extends TimelineException {
    public VocabularyMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
