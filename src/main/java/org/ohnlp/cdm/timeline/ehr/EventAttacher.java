package org.ohnlp.cdm.timeline.ehr;

import org.ohnlp.cdm.timeline.structs.Episode;
import org.ohnlp.cdm.timeline.structs.Event;
import org.ohnlp.cdm.timeline.structs.Person;
import org.ohnlp.cdm.timeline.structs.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places parsed events into the episodes of a timeline. Events naming a person outside the timeline, or an
 * episode the person does not have, are dropped and counted.
 */
public class EventAttacher {
    private static final Logger LOG = LoggerFactory.getLogger(EventAttacher.class);

    public AttachmentReport attach(Timeline timeline, String table, Map<String, List<Event>> eventsByPerson) {
        AttachmentReport report = new AttachmentReport(table);
        Set<Episode> touched = Collections.newSetFromMap(new IdentityHashMap<>());
        for (List<Event> events : eventsByPerson.values()) {
            for (Event event : events) {
                Person person = timeline.getPerson(event.getPersonId());
                if (person == null) {
                    LOG.debug("Dropping {} event for unknown person {}", table, event.getPersonId());
                    report.droppedUnknownPerson++;
                    continue;
                }
                Episode episode = person.getEpisode(event.getEpisodeId());
                if (episode == null) {
                    LOG.debug("Dropping {} event for unknown episode {} of person {}",
                            table, event.getEpisodeId(), event.getPersonId());
                    report.droppedUnknownEpisode++;
                    continue;
                }
                episode.addEvent(event);
                touched.add(episode);
                report.attached++;
            }
        }
        // Stable, so events read from a sorted table keep their order; other callers get theirs sorted here
        for (Episode episode : touched) {
            episode.sortEvents(table);
        }
        if (report.getDropped() > 0) {
            LOG.info("{}: attached {} events, dropped {} for unknown persons and {} for unknown episodes",
                    table, report.attached, report.droppedUnknownPerson, report.droppedUnknownEpisode);
        }
        return report;
    }

    public static class AttachmentReport {
        private final String table;
        private long attached;
        private long droppedUnknownPerson;
        private long droppedUnknownEpisode;

        public AttachmentReport(String table) {
            this.table = table;
        }

        public String getTable() {
            return table;
        }

        public long getAttached() {
            return attached;
        }

        public long getDroppedUnknownPerson() {
            return droppedUnknownPerson;
        }

        public long getDroppedUnknownEpisode() {
            return droppedUnknownEpisode;
        }

        public long getDropped() {
            return droppedUnknownPerson + droppedUnknownEpisode;
        }
    }
}
