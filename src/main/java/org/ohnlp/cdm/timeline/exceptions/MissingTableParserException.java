package org.ohnlp.cdm.timeline.exceptions;

/**
 * Thrown when a requested table has no registered parser.
 */
public class MissingTableParserException extends TimelineException {
    private final String table;

    public MissingTableParserException(String table) {
        super("Parser for table " + table + " is not implemented");
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
