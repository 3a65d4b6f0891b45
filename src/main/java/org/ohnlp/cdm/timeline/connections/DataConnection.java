package org.ohnlp.cdm.timeline.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;

import java.util.List;
import java.util.Set;

public interface DataConnection {
    /**
     * Loads data connection settings from configuration
     * @param node The configuration node
     */
    void loadConfig(JsonNode node);

    /**
     * Reads every record of a table as typed rows. Columns of the schema missing from the source are null unless
     * listed as required.
     * @param table The CDM table name, e.g. person
     * @param schema The Schema of the result rows; identifier columns should be declared as STRING
     * @param requiredColumns Columns that must be present in the source
     * @param rowLimit Maximum number of records to read, or null for all of them
     * @return The table's rows in source order
     * @throws org.ohnlp.cdm.timeline.exceptions.MissingSourceException if the table cannot be located
     * @throws org.ohnlp.cdm.timeline.exceptions.SchemaException if a required column is absent
     */
    List<Row> read(String table, Schema schema, Set<String> requiredColumns, Integer rowLimit);

    /**
     * @return a stable description of where this connection reads from, used to key cached timelines
     */
    String describe();
}
