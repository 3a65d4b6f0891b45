package org.ohnlp.cdm.timeline.ehr.tables;

import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.joda.time.ReadableInstant;
import org.ohnlp.cdm.timeline.connections.DataConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads a table through a {@link DataConnection}, drops rows missing identifiers or codes, and sorts the rest by
 * the table's sort columns. Every later stage relies on this ordering.
 */
public class TableReader {
    private static final Logger LOG = LoggerFactory.getLogger(TableReader.class);

    private final DataConnection connection;

    public TableReader(DataConnection connection) {
        this.connection = connection;
    }

    public List<Row> read(TableDefinition table) {
        return read(table, null);
    }

    public List<Row> read(TableDefinition table, Integer rowLimit) {
        List<Row> raw = connection.read(table.getName(), table.getSchema(), table.getRequiredColumns(), rowLimit);
        List<Row> rows = new ArrayList<>(raw.size());
        for (Row row : raw) {
            if (isComplete(row, table)) {
                rows.add(row);
            }
        }
        if (rows.size() < raw.size()) {
            LOG.debug("Dropped {} of {} {} rows missing one of {}",
                    raw.size() - rows.size(), raw.size(), table.getName(), table.getNonNullColumns());
        }
        rows.sort(ordering(table));
        return rows;
    }

    public DataConnection getConnection() {
        return connection;
    }

    private static boolean isComplete(Row row, TableDefinition table) {
        for (String column : table.getNonNullColumns()) {
            if (row.getValue(column) == null) {
                return false;
            }
        }
        return true;
    }

    static Comparator<Row> ordering(TableDefinition table) {
        Comparator<Row> ordering = (a, b) -> 0;
        for (String column : table.getSortColumns()) {
            ordering = ordering.thenComparing(byColumn(table.getSchema().getField(column).getType(), column));
        }
        return ordering;
    }

    // Nulls sort last in every column; identifiers compare as text
    private static Comparator<Row> byColumn(Schema.FieldType type, String column) {
        switch (type.getTypeName()) {
            case STRING:
                return Comparator.comparing((Row r) -> r.getString(column),
                        Comparator.nullsLast(Comparator.naturalOrder()));
            case DATETIME:
                return Comparator.comparing((Row r) -> millis(r.getDateTime(column)),
                        Comparator.nullsLast(Comparator.naturalOrder()));
            case INT32:
                return Comparator.comparing((Row r) -> r.getInt32(column),
                        Comparator.nullsLast(Comparator.naturalOrder()));
            case INT64:
                return Comparator.comparing((Row r) -> r.getInt64(column),
                        Comparator.nullsLast(Comparator.naturalOrder()));
            case DOUBLE:
                return Comparator.comparing((Row r) -> r.getDouble(column),
                        Comparator.nullsLast(Comparator.naturalOrder()));
            default:
                throw new IllegalArgumentException("Cannot sort on column " + column + " of type " + type);
        }
    }

    private static Long millis(ReadableInstant instant) {
        return instant == null ? null : instant.getMillis();
    }
}
