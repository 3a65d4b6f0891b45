package org.ohnlp.cdm.timeline.concurrent;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class PartitionResult<T> {
    private final Map<String, T> results;
    private final List<UnitFailure> failures;

    public PartitionResult(Map<String, T> results, List<UnitFailure> failures) {
        this.results = results;
        this.failures = failures;
    }

    /**
     * @return unit outputs keyed by person id, in partition order
     */
    public Map<String, T> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public List<UnitFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
