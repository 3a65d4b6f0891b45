package org.ohnlp.cdm.timeline.ehr.parsers;

import org.ohnlp.cdm.timeline.structs.Event;

import java.util.List;
import java.util.Map;

/**
 * Turns one clinical table into events grouped by person.
 */
public interface TableParser {
    /**
     * @return the CDM table this parser reads
     */
    String getTable();

    /**
     * @return the vocabulary every event produced by this parser is coded in
     */
    String getVocabulary();

    /**
     * Reads the table and produces each person's events ordered by episode id then timestamp. Referenced episodes
     * are not checked against the timeline.
     * @param context The run's reader, worker pool and vocabulary registry
     * @return events keyed by person id
     */
    Map<String, List<Event>> parse(ParseContext context);
}
