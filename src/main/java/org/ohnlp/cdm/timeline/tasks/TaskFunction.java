package org.ohnlp.cdm.timeline.tasks;

import org.ohnlp.cdm.timeline.structs.Person;

import java.util.List;
import java.util.Map;

/**
 * Converts one person's timeline into flat sample records. Returning an empty list excludes the person.
 */
@FunctionalInterface
public interface TaskFunction {
    List<Map<String, Object>> apply(Person person);
}
