package org.ohnlp.cdm.timeline.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.exceptions.MissingSourceException;
import org.ohnlp.cdm.timeline.exceptions.SchemaException;
import org.ohnlp.cdm.timeline.exceptions.TimelineException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads CDM tables from a live database. Every column is fetched as text and coerced the same way file extracts
 * are, so identifiers keep their exact representation.
 */
public class JDBCDataConnectionImpl implements DataConnection {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private String jdbcURL;
    private String user;
    private String password;
    private String cdmSchemaName;

    @Override
    public void loadConfig(JsonNode node) {
        if (node == null || !node.hasNonNull("url")) {
            throw new ConfigurationException("JDBC data connection requires a url");
        }
        if (node.has("driverClass")) {
            String driverClass = node.get("driverClass").asText();
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException e) {
                throw new ConfigurationException("JDBC driver " + driverClass + " is not on the classpath", e);
            }
        }
        this.jdbcURL = node.get("url").asText();
        if (node.has("user")) {
            this.user = node.get("user").asText();
            this.password = node.has("password") ? node.get("password").asText() : null;
        }
        this.cdmSchemaName = node.has("schema") ? node.get("schema").asText() : null;
        if (cdmSchemaName != null && !IDENTIFIER.matcher(cdmSchemaName).matches()) {
            throw new ConfigurationException("Invalid CDM schema name " + cdmSchemaName);
        }
    }

    @Override
    public List<Row> read(String table, Schema schema, Set<String> requiredColumns, Integer rowLimit) {
        if (!IDENTIFIER.matcher(table).matches()) {
            throw new MissingSourceException(table, "Invalid table name " + table);
        }
        String query = "SELECT * FROM " + (cdmSchemaName == null ? "" : cdmSchemaName + ".") + table;
        List<Row> rows = new ArrayList<>();
        try (Connection conn = connect();
             Statement stmt = conn.createStatement()) {
            if (rowLimit != null) {
                stmt.setMaxRows(rowLimit);
            }
            try (ResultSet rs = executeQuery(stmt, table, query)) {
                ResultSetMetaData md = rs.getMetaData();
                Map<String, Integer> columns = new HashMap<>();
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    columns.put(md.getColumnLabel(i).toLowerCase(Locale.ROOT), i);
                }
                for (String column : requiredColumns) {
                    if (!columns.containsKey(column.toLowerCase(Locale.ROOT))) {
                        throw new SchemaException(table, column);
                    }
                }
                long recordNumber = 0;
                while (rs.next()) {
                    recordNumber++;
                    List<Object> vals = new ArrayList<>();
                    for (Schema.Field f : schema.getFields()) {
                        Integer idx = columns.get(f.getName().toLowerCase(Locale.ROOT));
                        String raw = idx == null ? null : rs.getString(idx);
                        vals.add(CellValues.coerce(table, f, raw, recordNumber));
                    }
                    rows.add(Row.withSchema(schema).addValues(vals).build());
                }
            }
        } catch (SQLException e) {
            throw new TimelineException("Failed to read " + table + " from " + jdbcURL, e);
        }
        return rows;
    }

    private ResultSet executeQuery(Statement stmt, String table, String query) throws SQLException {
        try {
            return stmt.executeQuery(query);
        } catch (SQLException e) {
            // SQL state class 42 covers undefined tables and views
            if (e.getSQLState() != null && e.getSQLState().startsWith("42")) {
                throw new MissingSourceException(table, "Table " + table + " not found at " + jdbcURL, e);
            }
            throw e;
        }
    }

    private Connection connect() throws SQLException {
        if (user == null) {
            return DriverManager.getConnection(jdbcURL);
        }
        return DriverManager.getConnection(jdbcURL, user, password);
    }

    @Override
    public String describe() {
        return jdbcURL + (cdmSchemaName == null ? "" : "/" + cdmSchemaName);
    }
}
