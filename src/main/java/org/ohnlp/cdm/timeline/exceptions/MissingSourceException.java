package org.ohnlp.cdm.timeline.exceptions;

public class MissingSourceException extends TimelineException {
    private final String table;

    public MissingSourceException(String table, String message) {
        super(message);
        this.table = table;
    }

    public MissingSourceException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
