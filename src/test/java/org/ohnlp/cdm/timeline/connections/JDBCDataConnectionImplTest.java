package org.ohnlp.cdm.timeline.connections;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ohnlp.cdm.timeline.Fixtures;
import org.ohnlp.cdm.timeline.ehr.tables.CdmTables;
import org.ohnlp.cdm.timeline.ehr.tables.TableDefinition;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.exceptions.MissingSourceException;
import org.ohnlp.cdm.timeline.exceptions.SchemaException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JDBCDataConnectionImplTest {

    private String url;
    private JDBCDataConnectionImpl connection;

    @BeforeEach
    public void setUp() throws SQLException {
        url = "jdbc:h2:mem:cdm" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        try (Connection conn = DriverManager.getConnection(url);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE person (person_id VARCHAR(20), year_of_birth INT, month_of_birth INT, "
                    + "day_of_birth INT, gender_concept_id VARCHAR(20), race_concept_id VARCHAR(20))");
            stmt.execute("INSERT INTO person VALUES ('P1', 1980, 1, 1, '8507', '8527'), "
                    + "('P2', 1975, 6, 15, '8532', '8516'), ('P3', 1990, 12, 31, '8507', '8527')");
            stmt.execute("CREATE TABLE death (person_id VARCHAR(20), death_date DATE)");
            stmt.execute("INSERT INTO death VALUES ('P2', DATE '2019-03-12')");
            stmt.execute("CREATE TABLE visit_occurrence (person_id VARCHAR(20), visit_occurrence_id VARCHAR(20))");
        }
        ObjectNode config = new ObjectMapper().createObjectNode();
        config.put("url", url);
        config.put("driverClass", "org.h2.Driver");
        connection = new JDBCDataConnectionImpl();
        connection.loadConfig(config);
    }

    @Test
    public void testRead_MatchesFileConnection() {
        TableDefinition def = CdmTables.PERSON;
        List<Row> fromDb = connection.read(def.getName(), def.getSchema(), def.getRequiredColumns(), null);
        List<Row> fromFile = Fixtures.basicConnection().read(def.getName(), def.getSchema(),
                def.getRequiredColumns(), null);
        assertEquals(fromFile, fromDb);
    }

    @Test
    public void testRead_Date() {
        TableDefinition def = CdmTables.DEATH;
        List<Row> fromDb = connection.read(def.getName(), def.getSchema(), def.getRequiredColumns(), null);
        List<Row> fromFile = Fixtures.basicConnection().read(def.getName(), def.getSchema(),
                def.getRequiredColumns(), null);
        assertEquals(fromFile, fromDb);
    }

    @Test
    public void testRead_RowLimit() {
        TableDefinition def = CdmTables.PERSON;
        assertEquals(1, connection.read(def.getName(), def.getSchema(), def.getRequiredColumns(), 1).size());
    }

    @Test
    public void testRead_MissingTable() {
        TableDefinition def = CdmTables.CONDITION_OCCURRENCE;
        assertThrows(MissingSourceException.class, () ->
                connection.read(def.getName(), def.getSchema(), def.getRequiredColumns(), null));
    }

    @Test
    public void testRead_MissingColumn() {
        TableDefinition def = CdmTables.VISIT_OCCURRENCE;
        SchemaException e = assertThrows(SchemaException.class, () ->
                connection.read(def.getName(), def.getSchema(), def.getRequiredColumns(), null));
        assertEquals("visit_occurrence", e.getTable());
    }

    @Test
    public void testRead_IdsKeptAsText() throws SQLException {
        String idsUrl = "jdbc:h2:mem:ids" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        try (Connection conn = DriverManager.getConnection(idsUrl);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE person (person_id VARCHAR(20), year_of_birth INT, month_of_birth INT, "
                    + "day_of_birth INT, gender_concept_id INT, race_concept_id VARCHAR(20))");
            stmt.execute("INSERT INTO person VALUES ('007', 1980, 1, 1, 8507, '08527'), "
                    + "('0042', 1975, 6, 15, 8532, '8516')");
            stmt.execute("CREATE TABLE death (person_id BIGINT, death_date DATE)");
            stmt.execute("INSERT INTO death VALUES (7, DATE '2019-03-12')");
        }
        ObjectNode config = new ObjectMapper().createObjectNode();
        config.put("url", idsUrl);
        JDBCDataConnectionImpl ids = new JDBCDataConnectionImpl();
        ids.loadConfig(config);

        TableDefinition person = CdmTables.PERSON;
        List<Row> persons = ids.read(person.getName(), person.getSchema(), person.getRequiredColumns(), null);
        assertEquals("007", persons.get(0).getString("person_id"));
        assertEquals("0042", persons.get(1).getString("person_id"));
        assertEquals("08527", persons.get(0).getString("race_concept_id"));
        // Integer columns are read through their text form
        assertEquals("8507", persons.get(0).getString("gender_concept_id"));

        TableDefinition death = CdmTables.DEATH;
        List<Row> deaths = ids.read(death.getName(), death.getSchema(), death.getRequiredColumns(), null);
        assertEquals("7", deaths.get(0).getString("person_id"));
    }

    @Test
    public void testLoadConfig_Invalid() {
        ObjectMapper om = new ObjectMapper();
        assertThrows(ConfigurationException.class, () -> new JDBCDataConnectionImpl().loadConfig(om.createObjectNode()));
        ObjectNode badSchema = om.createObjectNode();
        badSchema.put("url", url);
        badSchema.put("schema", "cdm; DROP TABLE person");
        assertThrows(ConfigurationException.class, () -> new JDBCDataConnectionImpl().loadConfig(badSchema));
        ObjectNode badDriver = om.createObjectNode();
        badDriver.put("url", url);
        badDriver.put("driverClass", "org.example.NoSuchDriver");
        assertThrows(ConfigurationException.class, () -> new JDBCDataConnectionImpl().loadConfig(badDriver));
    }
}
