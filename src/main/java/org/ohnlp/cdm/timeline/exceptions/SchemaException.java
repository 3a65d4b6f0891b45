package org.ohnlp.cdm.timeline.exceptions;

/**
 * A required column is absent from a table source.
 */
public class SchemaException extends TimelineException {
    private final String table;
    private final String column;

    public SchemaException(String table, String column) {
        super("Table " + table + " is missing required column " + column);
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
