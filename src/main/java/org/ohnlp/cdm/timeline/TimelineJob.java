package org.ohnlp.cdm.timeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.ohnlp.cdm.timeline.concurrent.UnitFailure;
import org.ohnlp.cdm.timeline.connections.DataConnection;
import org.ohnlp.cdm.timeline.ehr.EventAttacher.AttachmentReport;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.mapping.CodeMappingConfig;
import org.ohnlp.cdm.timeline.mapping.CrossVocabularyMappingService;
import org.ohnlp.cdm.timeline.mapping.InMemoryCrossVocabularyMappingService;
import org.ohnlp.cdm.timeline.mapping.RestCrossVocabularyMappingService;
import org.ohnlp.cdm.timeline.mapping.VocabularyMapper.MappingReport;
import org.ohnlp.cdm.timeline.structs.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

public class TimelineJob {
    private static final Logger LOG = LoggerFactory.getLogger(TimelineJob.class);

    public static void main(String... args) throws IOException, ClassNotFoundException, InvocationTargetException,
            NoSuchMethodException, InstantiationException, IllegalAccessException {
        // Read in Pipeline Options
        PipelineOptionsFactory.register(JobConfiguration.class);
        JobConfiguration jobConfig = PipelineOptionsFactory.fromArgs(args).create().as(JobConfiguration.class);
        ObjectMapper om = new ObjectMapper();
        JsonNode config = readConfig(om, jobConfig.getConfig());

        TimelineDataset dataset = new TimelineDataset(toDatasetConfig(jobConfig, config));
        long tic = System.currentTimeMillis();
        TimelineResult result = dataset.load();
        LOG.info("Loaded {} in {}ms{}", result.getDatasetName(), System.currentTimeMillis() - tic,
                result.isFromCache() ? " (cached)" : "");
        logStatistics(result);
    }

    public static TimelineDatasetConfig toDatasetConfig(JobConfiguration jobConfig, JsonNode config)
            throws ClassNotFoundException, InvocationTargetException, NoSuchMethodException,
            InstantiationException, IllegalAccessException {
        JsonNode connection = config.get("dataConnection");
        if (connection == null || !connection.hasNonNull("class")) {
            throw new ConfigurationException("config.json requires a dataConnection with a class");
        }
        DataConnection connectionInstance = (DataConnection) instantiateZeroArgumentConstructorClass(connection.get("class").asText());
        connectionInstance.loadConfig(connection.get("config"));

        TimelineDatasetConfig datasetConfig = new TimelineDatasetConfig()
                .setDatasetName(jobConfig.getDatasetName())
                .setDataConnection(connectionInstance)
                .setCodeMapping(CodeMappingConfig.fromJson(config.get("codeMapping")))
                .setMappingService(mappingService(config.get("mappingService")))
                .setDev(jobConfig.getDev())
                .setDevRowLimit(jobConfig.getDevRowLimit())
                .setRefreshCache(jobConfig.getRefreshCache())
                .setTolerateUnitFailures(jobConfig.getTolerateUnitFailures());
        if (jobConfig.getTables() != null) {
            datasetConfig.setTables(jobConfig.getTables());
        }
        if (jobConfig.getCacheDir() != null) {
            datasetConfig.setCacheDirectory(Paths.get(jobConfig.getCacheDir()));
        }
        if (jobConfig.getWorkers() != null) {
            datasetConfig.setWorkers(jobConfig.getWorkers());
        }
        return datasetConfig;
    }

    /**
     * Either {@code {"type": "rest", "config": {"url": ..., "user": ..., "password": ...}}} or
     * {@code {"type": "codeTables", "tables": [{"source": ..., "target": ..., "path": ..., "delimiter": ...}]}}.
     */
    static CrossVocabularyMappingService mappingService(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String type = node.path("type").asText("rest");
        switch (type) {
            case "rest":
                return RestCrossVocabularyMappingService.fromConfig(node.get("config"));
            case "codeTables":
                InMemoryCrossVocabularyMappingService service = new InMemoryCrossVocabularyMappingService();
                for (JsonNode table : node.path("tables")) {
                    service.load(table.get("source").asText(), table.get("target").asText(),
                            Paths.get(table.get("path").asText()), table.path("delimiter").asText(","));
                }
                return service;
            default:
                throw new ConfigurationException("Unknown mapping service type " + type);
        }
    }

    private static JsonNode readConfig(ObjectMapper om, String path) throws IOException {
        if (path != null) {
            try (InputStream in = Files.newInputStream(Paths.get(path))) {
                return om.readTree(in);
            }
        }
        try (InputStream in = TimelineJob.class.getResourceAsStream("/config.json")) {
            if (in == null) {
                throw new ConfigurationException("No --config given and no config.json on the classpath");
            }
            return om.readTree(in);
        }
    }

    static void logStatistics(TimelineResult result) {
        Timeline timeline = result.getTimeline();
        LOG.info("Persons: {}, episodes: {}", timeline.size(), timeline.getEpisodeCount());
        for (Map.Entry<String, String> e : result.getRegistry().asMap().entrySet()) {
            LOG.info("{}: {} events coded in {}", e.getKey(), timeline.getEventCount(e.getKey()), e.getValue());
        }
        RunReport report = result.getReport();
        for (AttachmentReport attachment : report.getAttachments().values()) {
            if (attachment.getDropped() > 0) {
                LOG.warn("{}: dropped {} events of unknown persons and {} of unknown episodes",
                        attachment.getTable(), attachment.getDroppedUnknownPerson(),
                        attachment.getDroppedUnknownEpisode());
            }
        }
        for (UnitFailure failure : report.getUnitFailures()) {
            LOG.warn("Skipped {}", failure);
        }
        MappingReport mapping = report.getMapping();
        if (mapping != null && mapping.getEventsMapped() > 0) {
            LOG.info("Mapping: {} events in, {} out, {} without a counterpart",
                    mapping.getEventsIn(), mapping.getEventsOut(), mapping.getEventsRemoved());
        }
    }

    public static Object instantiateZeroArgumentConstructorClass(String clazz)
            throws ClassNotFoundException, NoSuchMethodException, InvocationTargetException,
            InstantiationException, IllegalAccessException {
        return Class.forName(clazz).getDeclaredConstructor().newInstance();
    }
}
