package org.ohnlp.cdm.timeline.ehr.tables;

import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.ReadableInstant;

public final class RowValues {
    private RowValues() {}

    /**
     * @return the DATETIME value of a column in UTC, or null
     */
    public static DateTime dateTime(Row row, String column) {
        ReadableInstant instant = row.getValue(column);
        return instant == null ? null : new DateTime(instant.getMillis(), DateTimeZone.UTC);
    }

    /**
     * @return the first non-null DATETIME value among the given columns, in UTC, or null
     */
    public static DateTime firstDateTime(Row row, String... columns) {
        for (String column : columns) {
            DateTime value = dateTime(row, column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
