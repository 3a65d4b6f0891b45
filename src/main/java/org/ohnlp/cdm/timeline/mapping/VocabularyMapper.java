package org.ohnlp.cdm.timeline.mapping;

import org.ohnlp.cdm.timeline.exceptions.VocabularyMappingException;
import org.ohnlp.cdm.timeline.structs.Episode;
import org.ohnlp.cdm.timeline.structs.Event;
import org.ohnlp.cdm.timeline.structs.Person;
import org.ohnlp.cdm.timeline.structs.Timeline;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites event codes according to a {@link CodeMappingConfig}.
 * <p>
 * Every event whose vocabulary is a configured source is replaced by one copy per code the mapping service
 * returns, in the returned order, with only code and vocabulary changed. An event whose code maps to nothing is
 * removed. Events in other vocabularies are left alone. Each event is mapped once; targets are not mapped again
 * even when they are themselves configured sources.
 */
public class VocabularyMapper {
    private static final Logger LOG = LoggerFactory.getLogger(VocabularyMapper.class);

    private final CrossVocabularyMappingService mappingService;

    public VocabularyMapper(CrossVocabularyMappingService mappingService) {
        this.mappingService = mappingService;
    }

    /**
     * Maps the timeline in place.
     * @param registry Vocabularies in effect before mapping; not modified
     * @return the timeline with a registry reflecting the mapping and counts of what changed
     */
    public MappingResult map(Timeline timeline, VocabularyRegistry registry, CodeMappingConfig config) {
        VocabularyRegistry mappedRegistry = new VocabularyRegistry(registry);
        MappingReport report = new MappingReport();
        if (config.isEmpty()) {
            return new MappingResult(timeline, mappedRegistry, report);
        }
        // One lookup per distinct (vocabulary, code) for the run
        Map<String, Map<String, List<String>>> memo = new HashMap<>();
        for (Person person : timeline.getPersons()) {
            for (Episode episode : person.getEpisodes()) {
                for (String table : new ArrayList<>(episode.getEventsByTable().keySet())) {
                    List<Event> events = episode.getEvents(table);
                    List<Event> mapped = new ArrayList<>(events.size());
                    for (Event event : events) {
                        report.eventsIn++;
                        CodeMappingTarget target = config.getTarget(event.getVocabulary());
                        if (target == null) {
                            mapped.add(event);
                            continue;
                        }
                        List<String> codes = memo
                                .computeIfAbsent(event.getVocabulary(), k -> new HashMap<>())
                                .computeIfAbsent(event.getCode(), code -> lookup(event.getVocabulary(), target, code));
                        for (String code : codes) {
                            mapped.add(event.withCode(code, target.getTargetVocabulary()));
                        }
                        report.eventsMapped++;
                        if (codes.isEmpty()) {
                            report.eventsRemoved++;
                        }
                        mappedRegistry.recordMapping(table, event.getVocabulary(), target.getTargetVocabulary());
                    }
                    report.eventsOut += mapped.size();
                    episode.setEvents(table, mapped);
                }
            }
        }
        LOG.info("Mapped {} of {} events, {} events after mapping, {} had no counterpart",
                report.eventsMapped, report.eventsIn, report.eventsOut, report.eventsRemoved);
        return new MappingResult(timeline, mappedRegistry, report);
    }

    private List<String> lookup(String sourceVocabulary, CodeMappingTarget target, String code) {
        try {
            List<String> codes = mappingService.map(sourceVocabulary, target.getTargetVocabulary(), code,
                    target.getSourceOptions(), target.getTargetOptions());
            return codes == null ? List.of() : List.copyOf(codes);
        } catch (RuntimeException e) {
            throw new VocabularyMappingException("Failed to map " + sourceVocabulary + " code " + code
                    + " to " + target.getTargetVocabulary(), e);
        }
    }

    public static class MappingResult {
        private final Timeline timeline;
        private final VocabularyRegistry registry;
        private final MappingReport report;

        public MappingResult(Timeline timeline, VocabularyRegistry registry, MappingReport report) {
            this.timeline = timeline;
            this.registry = registry;
            this.report = report;
        }

        public Timeline getTimeline() {
            return timeline;
        }

        public VocabularyRegistry getRegistry() {
            return registry;
        }

        public MappingReport getReport() {
            return report;
        }
    }

    public static class MappingReport {
        private long eventsIn;
        private long eventsOut;
        private long eventsMapped;
        private long eventsRemoved;

        public long getEventsIn() {
            return eventsIn;
        }

        public long getEventsOut() {
            return eventsOut;
        }

        public long getEventsMapped() {
            return eventsMapped;
        }

        /**
         * @return source events whose code mapped to nothing
         */
        public long getEventsRemoved() {
            return eventsRemoved;
        }
    }
}
