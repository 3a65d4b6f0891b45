package org.ohnlp.cdm.timeline.exceptions;

/**
 * A cell or a group of cells could not be coerced to the value it should hold.
 */
public class RecordParseException extends TimelineException {
    private final String table;
    private final String column;

    public RecordParseException(String table, String column, String message) {
        super(message);
        this.table = table;
        this.column = column;
    }

    public RecordParseException(String table, String column, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }
}
