package org.ohnlp.cdm.timeline.tasks;

import org.ohnlp.cdm.timeline.TimelineResult;
import org.ohnlp.cdm.timeline.structs.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TaskSampler {
    private static final Logger LOG = LoggerFactory.getLogger(TaskSampler.class);

    /**
     * Applies a task function to every person in timeline order and concatenates the records.
     */
    public SampleDataset sample(TimelineResult result, TaskFunction task, String taskName) {
        List<Map<String, Object>> samples = new ArrayList<>();
        int contributing = 0;
        for (Person person : result.getTimeline().getPersons()) {
            List<Map<String, Object>> records = task.apply(person);
            if (records != null && !records.isEmpty()) {
                samples.addAll(records);
                contributing++;
            }
        }
        LOG.info("Generated {} samples for {} from {} of {} persons",
                samples.size(), taskName, contributing, result.getTimeline().size());
        return new SampleDataset(result.getDatasetName(), taskName, samples,
                new LinkedHashMap<>(result.getRegistry().asMap()));
    }
}
