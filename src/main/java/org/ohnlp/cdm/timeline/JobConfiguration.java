package org.ohnlp.cdm.timeline;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;

import java.util.List;

public interface JobConfiguration extends PipelineOptions {
    @Description("Name of the dataset, part of the cache key")
    @Default.String(TimelineDatasetConfig.DEFAULT_DATASET_NAME)
    String getDatasetName();
    void setDatasetName(String datasetName);

    @Description("Clinical tables to load in addition to person, visit_occurrence and death")
    List<String> getTables();
    void setTables(List<String> tables);

    @Description("Path to the JSON configuration holding dataConnection, codeMapping and mappingService")
    String getConfig();
    void setConfig(String config);

    @Description("Only read the first devRowLimit persons")
    @Default.Boolean(false)
    Boolean getDev();
    void setDev(Boolean dev);

    @Description("Number of person rows read in dev mode")
    @Default.Integer(TimelineDatasetConfig.DEFAULT_DEV_ROW_LIMIT)
    Integer getDevRowLimit();
    void setDevRowLimit(Integer devRowLimit);

    @Description("Rebuild the timeline even if a cached copy exists")
    @Default.Boolean(false)
    Boolean getRefreshCache();
    void setRefreshCache(Boolean refreshCache);

    @Description("Directory holding cached timelines, defaults to ~/.cache/cdm-timeline")
    String getCacheDir();
    void setCacheDir(String cacheDir);

    @Description("Worker threads for per-person parsing, defaults to the number of processors")
    Integer getWorkers();
    void setWorkers(Integer workers);

    @Description("Skip persons whose rows fail to parse instead of failing the run")
    @Default.Boolean(false)
    Boolean getTolerateUnitFailures();
    void setTolerateUnitFailures(Boolean tolerateUnitFailures);
}
