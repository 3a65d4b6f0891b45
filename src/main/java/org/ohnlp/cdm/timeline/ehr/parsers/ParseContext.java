package org.ohnlp.cdm.timeline.ehr.parsers;

import org.ohnlp.cdm.timeline.concurrent.PersonPartitionExecutor;
import org.ohnlp.cdm.timeline.concurrent.UnitFailure;
import org.ohnlp.cdm.timeline.ehr.tables.TableReader;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a parser needs for one run. Only touched from the thread driving the run.
 */
public class ParseContext {
    private final TableReader reader;
    private final PersonPartitionExecutor executor;
    private final VocabularyRegistry registry;
    private final List<UnitFailure> failures = new ArrayList<>();

    public ParseContext(TableReader reader, PersonPartitionExecutor executor, VocabularyRegistry registry) {
        this.reader = reader;
        this.executor = executor;
        this.registry = registry;
    }

    public TableReader getReader() {
        return reader;
    }

    public PersonPartitionExecutor getExecutor() {
        return executor;
    }

    public VocabularyRegistry getRegistry() {
        return registry;
    }

    public void recordFailures(List<UnitFailure> unitFailures) {
        failures.addAll(unitFailures);
    }

    public List<UnitFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
