package org.ohnlp.cdm.timeline.connections;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ohnlp.cdm.timeline.Fixtures;
import org.ohnlp.cdm.timeline.ehr.tables.CdmTables;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.exceptions.MissingSourceException;
import org.ohnlp.cdm.timeline.exceptions.SchemaException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class FileBasedDataConnectionImplTest {

    @TempDir
    Path tmp;

    @Test
    public void testRead_Person() {
        List<Row> rows = Fixtures.basicConnection().read("person", CdmTables.PERSON.getSchema(),
                CdmTables.PERSON.getRequiredColumns(), null);
        assertEquals(3, rows.size());
        assertEquals("P1", rows.get(0).getString("person_id"));
        assertEquals(1980, rows.get(0).getInt32("year_of_birth"));
        assertEquals("8507", rows.get(0).getString("gender_concept_id"));
    }

    @Test
    public void testRead_RowLimit() {
        List<Row> rows = Fixtures.basicConnection().read("person", CdmTables.PERSON.getSchema(),
                CdmTables.PERSON.getRequiredColumns(), 2);
        assertEquals(2, rows.size());
    }

    @Test
    public void testRead_MissingFile() {
        MissingSourceException e = assertThrows(MissingSourceException.class, () ->
                Fixtures.basicConnection().read("measurement", CdmTables.MEASUREMENT.getSchema(),
                        CdmTables.MEASUREMENT.getRequiredColumns(), null));
        assertEquals("measurement", e.getTable());
    }

    @Test
    public void testRead_MissingColumn() throws IOException {
        Files.write(tmp.resolve("death.csv"), "person_id\nP1\n".getBytes(StandardCharsets.UTF_8));
        FileBasedDataConnectionImpl connection = new FileBasedDataConnectionImpl(tmp.toString(), "\t", false);
        SchemaException e = assertThrows(SchemaException.class, () ->
                connection.read("death", CdmTables.DEATH.getSchema(), CdmTables.DEATH.getRequiredColumns(), null));
        assertEquals("death_date", e.getColumn());
        assertEquals("Table death is missing required column death_date", e.getMessage());
    }

    @Test
    public void testRead_OptionalColumnAbsent() throws IOException {
        Files.write(tmp.resolve("condition_occurrence.csv"),
                ("PERSON_ID,VISIT_OCCURRENCE_ID,CONDITION_CONCEPT_ID,CONDITION_START_DATETIME\n"
                        + "P1,V1,C1,2020-01-02\n").getBytes(StandardCharsets.UTF_8));
        FileBasedDataConnectionImpl connection = new FileBasedDataConnectionImpl(tmp.toString(), ",", false);
        List<Row> rows = connection.read("condition_occurrence", CdmTables.CONDITION_OCCURRENCE.getSchema(),
                CdmTables.CONDITION_OCCURRENCE.getRequiredColumns(), null);
        assertEquals(1, rows.size());
        assertEquals("C1", rows.get(0).getString("condition_concept_id"));
        assertNull(rows.get(0).getValue("condition_type_concept_id"));
    }

    @Test
    public void testRead_LeadingZeroIdsKeptAsText() throws IOException {
        Files.write(tmp.resolve("person.csv"), ("person_id,year_of_birth,month_of_birth,day_of_birth,"
                + "gender_concept_id,race_concept_id\n"
                + "007,1980,1,1,08507,8527\n"
                + "0042,1975,6,15,8532,8516\n").getBytes(StandardCharsets.UTF_8));
        FileBasedDataConnectionImpl connection = new FileBasedDataConnectionImpl(tmp.toString(), ",", false);
        List<Row> rows = connection.read("person", CdmTables.PERSON.getSchema(),
                CdmTables.PERSON.getRequiredColumns(), null);
        assertEquals("007", rows.get(0).getString("person_id"));
        assertEquals("0042", rows.get(1).getString("person_id"));
        assertEquals("08507", rows.get(0).getString("gender_concept_id"));
    }

    @Test
    public void testRead_Compressed() throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp.resolve("death.csv.gz")));
             Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            writer.write("person_id\tdeath_date\nP2\t2019-03-12\n");
        }
        FileBasedDataConnectionImpl connection = new FileBasedDataConnectionImpl(tmp.toString(), "\t", true);
        List<Row> rows = connection.read("death", CdmTables.DEATH.getSchema(),
                CdmTables.DEATH.getRequiredColumns(), null);
        assertEquals(1, rows.size());
        assertEquals("P2", rows.get(0).getString("person_id"));
    }

    @Test
    public void testLoadConfig() throws IOException {
        FileBasedDataConnectionImpl connection = new FileBasedDataConnectionImpl();
        connection.loadConfig(new ObjectMapper().readTree("{\"path\": \"/data/omop\", \"compressed\": true}"));
        assertEquals("/data/omop", connection.describe());
        assertTrue(connection.resolve("person").toString().endsWith("person.csv.gz"));

        assertThrows(ConfigurationException.class, () ->
                new FileBasedDataConnectionImpl().loadConfig(new ObjectMapper().readTree("{}")));
    }
}
