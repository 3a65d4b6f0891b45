package org.ohnlp.cdm.timeline;

import org.ohnlp.cdm.timeline.connections.DataConnection;
import org.ohnlp.cdm.timeline.ehr.parsers.TableParserRegistry;
import org.ohnlp.cdm.timeline.mapping.CodeMappingConfig;
import org.ohnlp.cdm.timeline.mapping.CrossVocabularyMappingService;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings for one {@link TimelineDataset} build.
 */
public class TimelineDatasetConfig {
    public static final String DEFAULT_DATASET_NAME = "OMOPDataset";
    public static final int DEFAULT_DEV_ROW_LIMIT = 1000;

    private String datasetName = DEFAULT_DATASET_NAME;
    private DataConnection dataConnection;
    private List<String> tables = new ArrayList<>();
    private CodeMappingConfig codeMapping = CodeMappingConfig.empty();
    private CrossVocabularyMappingService mappingService;
    private TableParserRegistry parserRegistry = TableParserRegistry.defaults();
    private boolean dev;
    private int devRowLimit = DEFAULT_DEV_ROW_LIMIT;
    private boolean refreshCache;
    private boolean cacheEnabled = true;
    private Path cacheDirectory = Paths.get(System.getProperty("user.home"), ".cache", "cdm-timeline");
    private int workers = Runtime.getRuntime().availableProcessors();
    private boolean tolerateUnitFailures;

    public String getDatasetName() {
        return datasetName;
    }

    public TimelineDatasetConfig setDatasetName(String datasetName) {
        this.datasetName = datasetName;
        return this;
    }

    public DataConnection getDataConnection() {
        return dataConnection;
    }

    public TimelineDatasetConfig setDataConnection(DataConnection dataConnection) {
        this.dataConnection = dataConnection;
        return this;
    }

    public List<String> getTables() {
        return Collections.unmodifiableList(tables);
    }

    public TimelineDatasetConfig setTables(List<String> tables) {
        this.tables = new ArrayList<>(tables);
        return this;
    }

    public CodeMappingConfig getCodeMapping() {
        return codeMapping;
    }

    public TimelineDatasetConfig setCodeMapping(CodeMappingConfig codeMapping) {
        this.codeMapping = codeMapping;
        return this;
    }

    public CrossVocabularyMappingService getMappingService() {
        return mappingService;
    }

    public TimelineDatasetConfig setMappingService(CrossVocabularyMappingService mappingService) {
        this.mappingService = mappingService;
        return this;
    }

    public TableParserRegistry getParserRegistry() {
        return parserRegistry;
    }

    public TimelineDatasetConfig setParserRegistry(TableParserRegistry parserRegistry) {
        this.parserRegistry = parserRegistry;
        return this;
    }

    public boolean isDev() {
        return dev;
    }

    public TimelineDatasetConfig setDev(boolean dev) {
        this.dev = dev;
        return this;
    }

    public int getDevRowLimit() {
        return devRowLimit;
    }

    public TimelineDatasetConfig setDevRowLimit(int devRowLimit) {
        this.devRowLimit = devRowLimit;
        return this;
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public TimelineDatasetConfig setRefreshCache(boolean refreshCache) {
        this.refreshCache = refreshCache;
        return this;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public TimelineDatasetConfig setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
        return this;
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    public TimelineDatasetConfig setCacheDirectory(Path cacheDirectory) {
        this.cacheDirectory = cacheDirectory;
        return this;
    }

    public int getWorkers() {
        return workers;
    }

    public TimelineDatasetConfig setWorkers(int workers) {
        this.workers = workers;
        return this;
    }

    public boolean isTolerateUnitFailures() {
        return tolerateUnitFailures;
    }

    /**
     * When set, a person whose rows fail to parse is left out of the timeline and reported instead of failing the run.
     */
    public TimelineDatasetConfig setTolerateUnitFailures(boolean tolerateUnitFailures) {
        this.tolerateUnitFailures = tolerateUnitFailures;
        return this;
    }
}
