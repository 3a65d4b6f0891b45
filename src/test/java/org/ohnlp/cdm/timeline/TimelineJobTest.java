package org.ohnlp.cdm.timeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ohnlp.cdm.timeline.connections.FileBasedDataConnectionImpl;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.mapping.InMemoryCrossVocabularyMappingService;
import org.ohnlp.cdm.timeline.mapping.RestCrossVocabularyMappingService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TimelineJobTest {

    @TempDir
    Path tmp;

    private final ObjectMapper om = new ObjectMapper();

    private ObjectNode fileConfig() {
        ObjectNode config = om.createObjectNode();
        ObjectNode connection = config.putObject("dataConnection");
        connection.put("class", FileBasedDataConnectionImpl.class.getName());
        connection.putObject("config").put("path", Fixtures.basicRoot().toString());
        return config;
    }

    private static JobConfiguration options(String... args) {
        PipelineOptionsFactory.register(JobConfiguration.class);
        return PipelineOptionsFactory.fromArgs(args).create().as(JobConfiguration.class);
    }

    @Test
    public void testToDatasetConfig() throws Exception {
        ObjectNode config = fileConfig();
        config.putObject("codeMapping").put("CONDITION_CONCEPT_ID", "CCS");
        config.putObject("mappingService").put("type", "rest").putObject("config").put("url", "http://vocab.local");

        TimelineDatasetConfig datasetConfig = TimelineJob.toDatasetConfig(options(
                "--datasetName=Synthetic", "--tables=condition_occurrence", "--tables=drug_exposure",
                "--dev=true", "--workers=2", "--cacheDir=" + tmp), config);

        assertEquals("Synthetic", datasetConfig.getDatasetName());
        assertEquals(List.of("condition_occurrence", "drug_exposure"), datasetConfig.getTables());
        assertTrue(datasetConfig.isDev());
        assertEquals(TimelineDatasetConfig.DEFAULT_DEV_ROW_LIMIT, datasetConfig.getDevRowLimit());
        assertFalse(datasetConfig.isRefreshCache());
        assertEquals(2, datasetConfig.getWorkers());
        assertEquals(tmp, datasetConfig.getCacheDirectory());
        assertEquals(Fixtures.basicRoot().toString(), datasetConfig.getDataConnection().describe());
        assertEquals("CCS", datasetConfig.getCodeMapping().getTarget("CONDITION_CONCEPT_ID").getTargetVocabulary());
        assertTrue(datasetConfig.getMappingService() instanceof RestCrossVocabularyMappingService);
    }

    @Test
    public void testToDatasetConfig_MissingConnection() {
        assertThrows(ConfigurationException.class, () ->
                TimelineJob.toDatasetConfig(options(), om.createObjectNode()));
    }

    @Test
    public void testMappingService_CodeTables() throws IOException {
        Path codes = tmp.resolve("condition_ccs.csv");
        Files.write(codes, "source_code,target_code\nC1,49\n".getBytes(StandardCharsets.UTF_8));
        JsonNode node = om.readTree("{\"type\": \"codeTables\", \"tables\": [{\"source\": \"CONDITION_CONCEPT_ID\", "
                + "\"target\": \"CCS\", \"path\": " + om.writeValueAsString(codes.toString()) + "}]}");

        InMemoryCrossVocabularyMappingService service =
                (InMemoryCrossVocabularyMappingService) TimelineJob.mappingService(node);

        assertEquals(List.of("49"), service.map("CONDITION_CONCEPT_ID", "CCS", "C1", Map.of(), Map.of()));
        assertNull(TimelineJob.mappingService(null));
        assertThrows(ConfigurationException.class, () ->
                TimelineJob.mappingService(om.readTree("{\"type\": \"ldap\"}")));
    }

    @Test
    public void testMain() throws Exception {
        Path codes = tmp.resolve("condition_ccs.csv");
        Files.write(codes, "source_code,target_code\nC1,49\nC2,50\nC3,50\n".getBytes(StandardCharsets.UTF_8));
        ObjectNode config = fileConfig();
        config.putObject("codeMapping").put("CONDITION_CONCEPT_ID", "CCS");
        ObjectNode service = config.putObject("mappingService");
        service.put("type", "codeTables");
        ObjectNode table = service.putArray("tables").addObject();
        table.put("source", "CONDITION_CONCEPT_ID");
        table.put("target", "CCS");
        table.put("path", codes.toString());
        Path configFile = tmp.resolve("config.json");
        om.writeValue(configFile.toFile(), config);
        Path cacheDir = tmp.resolve("cache");

        TimelineJob.main("--config=" + configFile, "--tables=condition_occurrence", "--cacheDir=" + cacheDir);

        try (Stream<Path> files = Files.list(cacheDir)) {
            assertEquals(1, files.filter(p -> p.toString().endsWith(".timeline")).count());
        }
    }
}
