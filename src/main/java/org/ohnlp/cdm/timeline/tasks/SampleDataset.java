package org.ohnlp.cdm.timeline.tasks;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class SampleDataset {
    private final String datasetName;
    private final String taskName;
    private final List<Map<String, Object>> samples;
    private final Map<String, String> vocabularies;

    public SampleDataset(String datasetName, String taskName, List<Map<String, Object>> samples,
                         Map<String, String> vocabularies) {
        this.datasetName = datasetName;
        this.taskName = taskName;
        this.samples = Collections.unmodifiableList(samples);
        this.vocabularies = Collections.unmodifiableMap(vocabularies);
    }

    public String getDatasetName() {
        return datasetName;
    }

    public String getTaskName() {
        return taskName;
    }

    public List<Map<String, Object>> getSamples() {
        return samples;
    }

    /**
     * @return table to vocabulary the samples' codes are in
     */
    public Map<String, String> getVocabularies() {
        return vocabularies;
    }

    public int size() {
        return samples.size();
    }
}
