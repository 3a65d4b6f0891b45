package org.ohnlp.cdm.timeline.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.exceptions.MissingSourceException;
import org.ohnlp.cdm.timeline.exceptions.SchemaException;
import org.ohnlp.cdm.timeline.exceptions.TimelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Reads CDM tables from a directory holding one delimited file per table, named {table}.csv or {table}.csv.gz.
 */
public class FileBasedDataConnectionImpl implements DataConnection {
    private static final Logger LOG = LoggerFactory.getLogger(FileBasedDataConnectionImpl.class);

    public static final String DEFAULT_DELIMITER = "\t";

    private String path;
    private String delimiter = DEFAULT_DELIMITER;
    private boolean compressed;

    public FileBasedDataConnectionImpl() {}

    public FileBasedDataConnectionImpl(String path, String delimiter, boolean compressed) {
        this.path = path;
        this.delimiter = delimiter;
        this.compressed = compressed;
    }

    @Override
    public void loadConfig(JsonNode node) {
        if (node == null || !node.hasNonNull("path")) {
            throw new ConfigurationException("File based data connection requires a path");
        }
        this.path = node.get("path").asText();
        this.delimiter = node.has("delimiter") ? node.get("delimiter").asText() : DEFAULT_DELIMITER;
        this.compressed = node.has("compressed") && node.get("compressed").asBoolean();
    }

    @Override
    public List<Row> read(String table, Schema schema, Set<String> requiredColumns, Integer rowLimit) {
        Path file = resolve(table);
        if (!Files.isRegularFile(file)) {
            throw new MissingSourceException(table, "Table " + table + " not found at " + file);
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<Row> rows = new ArrayList<>();
        try (InputStream in = open(file);
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
             CSVParser parser = format.parse(reader)) {
            // Header lookups are case-insensitive, exports disagree on PERSON_ID vs person_id
            Map<String, String> headers = new HashMap<>();
            for (String header : parser.getHeaderNames()) {
                headers.put(header.trim().toLowerCase(Locale.ROOT), header);
            }
            for (String column : requiredColumns) {
                if (!headers.containsKey(column.toLowerCase(Locale.ROOT))) {
                    throw new SchemaException(table, column);
                }
            }
            List<Schema.Field> fields = schema.getFields();
            for (CSVRecord record : parser) {
                if (rowLimit != null && rows.size() >= rowLimit) {
                    break;
                }
                List<Object> vals = new ArrayList<>(fields.size());
                for (Schema.Field f : fields) {
                    String header = headers.get(f.getName().toLowerCase(Locale.ROOT));
                    String raw = header != null && record.isSet(header) ? record.get(header) : null;
                    vals.add(CellValues.coerce(table, f, raw, record.getRecordNumber()));
                }
                rows.add(Row.withSchema(schema).addValues(vals).build());
            }
        } catch (IOException e) {
            throw new TimelineException("Failed to read " + table + " from " + file, e);
        }
        LOG.debug("Read {} records from {}", rows.size(), file);
        return rows;
    }

    @Override
    public String describe() {
        return path;
    }

    Path resolve(String table) {
        return Paths.get(path, table + ".csv" + (compressed ? ".gz" : ""));
    }

    private InputStream open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (!compressed) {
            return in;
        }
        try {
            return new GZIPInputStream(in);
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    public String getPath() {
        return path;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public boolean isCompressed() {
        return compressed;
    }
}
