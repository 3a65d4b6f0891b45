package org.ohnlp.cdm.timeline;

import org.ohnlp.cdm.timeline.structs.Timeline;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;

/**
 * The assembled timeline, the vocabulary each table ends up coded in, and how the build went.
 */
public class TimelineResult {
    private final String datasetName;
    private final Timeline timeline;
    private final VocabularyRegistry registry;
    private final RunReport report;
    private final boolean fromCache;

    public TimelineResult(String datasetName, Timeline timeline, VocabularyRegistry registry, RunReport report,
                          boolean fromCache) {
        this.datasetName = datasetName;
        this.timeline = timeline;
        this.registry = registry;
        this.report = report;
        this.fromCache = fromCache;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public VocabularyRegistry getRegistry() {
        return registry;
    }

    public RunReport getReport() {
        return report;
    }

    public boolean isFromCache() {
        return fromCache;
    }
}
