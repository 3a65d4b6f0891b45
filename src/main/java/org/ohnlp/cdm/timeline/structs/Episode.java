package org.ohnlp.cdm.timeline.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One care encounter (an OMOP visit_occurrence) and the events recorded during it, by source table.
 */
public class Episode implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final Comparator<Event> BY_TIMESTAMP =
            Comparator.comparing(Event::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    private String episodeId;
    private String personId;
    // Owner, set by Person#addEpisode. Not part of equality.
    private Person person;
    private DateTime encounterTime;
    private DateTime dischargeTime;
    private DischargeStatus dischargeStatus;
    private Map<String, List<Event>> eventsByTable = new LinkedHashMap<>();

    public Episode() {}

    public Episode(String episodeId, String personId, DateTime encounterTime, DateTime dischargeTime,
                   DischargeStatus dischargeStatus) {
        this.episodeId = episodeId;
        this.personId = personId;
        this.encounterTime = encounterTime;
        this.dischargeTime = dischargeTime;
        this.dischargeStatus = dischargeStatus;
    }

    public void addEvent(Event event) {
        if (!episodeId.equals(event.getEpisodeId())) {
            throw new IllegalArgumentException("Event for episode " + event.getEpisodeId()
                    + " cannot be added to episode " + episodeId);
        }
        eventsByTable.computeIfAbsent(event.getTable(), k -> new ArrayList<>()).add(event);
    }

    /**
     * Stable-sorts the event list of the given table ascending by timestamp, events without one last.
     */
    public void sortEvents(String table) {
        List<Event> events = eventsByTable.get(table);
        if (events != null) {
            events.sort(BY_TIMESTAMP);
        }
    }

    public List<Event> getEvents(String table) {
        return eventsByTable.getOrDefault(table, Collections.emptyList());
    }

    public void setEvents(String table, List<Event> events) {
        eventsByTable.put(table, new ArrayList<>(events));
    }

    public List<String> getAvailableTables() {
        List<String> ret = new ArrayList<>();
        eventsByTable.forEach((table, events) -> {
            if (!events.isEmpty()) {
                ret.add(table);
            }
        });
        return ret;
    }

    public int getEventCount() {
        return eventsByTable.values().stream().mapToInt(List::size).sum();
    }

    public String getEpisodeId() {
        return episodeId;
    }

    public String getPersonId() {
        return personId;
    }

    public Person getPerson() {
        return person;
    }

    void setPerson(Person person) {
        this.person = person;
    }

    public DateTime getEncounterTime() {
        return encounterTime;
    }

    public DateTime getDischargeTime() {
        return dischargeTime;
    }

    public DischargeStatus getDischargeStatus() {
        return dischargeStatus;
    }

    public Map<String, List<Event>> getEventsByTable() {
        return eventsByTable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Episode episode = (Episode) o;
        return Objects.equals(episodeId, episode.episodeId)
                && Objects.equals(personId, episode.personId)
                && Objects.equals(encounterTime, episode.encounterTime)
                && Objects.equals(dischargeTime, episode.dischargeTime)
                && dischargeStatus == episode.dischargeStatus
                && Objects.equals(eventsByTable, episode.eventsByTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(episodeId, personId);
    }

    @Override
    public String toString() {
        return "Episode{" + episodeId + ", person=" + personId + ", " + encounterTime + " -> " + dischargeTime
                + ", " + dischargeStatus + ", events=" + getEventCount() + "}";
    }
}
