package org.ohnlp.cdm.timeline.connections;

import org.apache.beam.sdk.schemas.Schema;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.DateTimeFormatterBuilder;
import org.joda.time.format.DateTimeParser;
import org.joda.time.format.ISODateTimeFormat;
import org.ohnlp.cdm.timeline.exceptions.RecordParseException;

import java.math.BigDecimal;

/**
 * Converts raw text cells into the Java values Beam expects for a {@link Schema.FieldType}.
 */
public final class CellValues {

    // Accepts dates, ISO-8601 date-times and the space separated form written by most database exports
    private static final DateTimeFormatter DATETIME_PARSER = new DateTimeFormatterBuilder()
            .append(null, new DateTimeParser[]{
                    ISODateTimeFormat.dateOptionalTimeParser().getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss.SSS").getParser()
            })
            .toFormatter()
            .withZoneUTC();

    private CellValues() {}

    public static DateTime parseDateTime(String raw) {
        return DATETIME_PARSER.parseDateTime(raw.trim());
    }

    /**
     * @param table Table the cell belongs to, for error reporting
     * @param field Target field
     * @param raw Raw text, blank means null
     * @param recordNumber Record number within the source, for error reporting
     */
    public static Object coerce(String table, Schema.Field field, String raw, long recordNumber) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Schema.FieldType type = field.getType();
        try {
            switch (type.getTypeName()) {
                case STRING:
                    return raw.trim();
                case INT32:
                    return parseInteger(raw.trim());
                case INT64:
                    return Long.parseLong(raw.trim());
                case DOUBLE:
                    return Double.parseDouble(raw.trim());
                case DATETIME:
                    return parseDateTime(raw);
                default:
                    throw new UnsupportedOperationException("Unsupported column type " + type.getTypeName());
            }
        } catch (IllegalArgumentException e) {
            throw new RecordParseException(table, field.getName(),
                    "Cannot read " + field.getName() + " value '" + raw + "' of " + table
                            + " record " + recordNumber + " as " + type.getTypeName(), e);
        }
    }

    // Exports through floating point columns turn 1980 into 1980.0
    private static Integer parseInteger(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(raw).intValueExact();
            } catch (ArithmeticException ex) {
                throw new NumberFormatException("Not an integer: " + raw);
            }
        }
    }
}
