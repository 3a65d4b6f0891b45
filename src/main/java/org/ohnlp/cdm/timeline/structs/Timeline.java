package org.ohnlp.cdm.timeline.structs;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All persons of one run keyed by person id, with a dataset-wide episode id index.
 */
public class Timeline implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Person> persons = new LinkedHashMap<>();
    private final HashMap<String, String> episodeOwners = new HashMap<>();

    /**
     * Adds a fully assembled person. Person ids and episode ids must not already be present.
     */
    public void addPerson(Person person) {
        if (persons.containsKey(person.getPersonId())) {
            throw new IllegalArgumentException("Duplicate person " + person.getPersonId());
        }
        for (String episodeId : person.episodeIndex().keySet()) {
            String owner = episodeOwners.get(episodeId);
            if (owner != null) {
                throw new IllegalArgumentException("Episode " + episodeId + " of person " + person.getPersonId()
                        + " is already owned by person " + owner);
            }
        }
        persons.put(person.getPersonId(), person);
        person.episodeIndex().keySet().forEach(v -> episodeOwners.put(v, person.getPersonId()));
    }

    public Person getPerson(String personId) {
        return persons.get(personId);
    }

    public boolean containsPerson(String personId) {
        return persons.containsKey(personId);
    }

    /**
     * @return the id of the person owning the given episode, or null if no person owns it
     */
    public String getPersonIdForEpisode(String episodeId) {
        return episodeOwners.get(episodeId);
    }

    public Collection<Person> getPersons() {
        return Collections.unmodifiableCollection(persons.values());
    }

    public List<String> getPersonIds() {
        return new ArrayList<>(persons.keySet());
    }

    public Map<String, Person> asMap() {
        return Collections.unmodifiableMap(persons);
    }

    public int size() {
        return persons.size();
    }

    public int getEpisodeCount() {
        return episodeOwners.size();
    }

    public long getEventCount(String table) {
        long count = 0;
        for (Person person : persons.values()) {
            for (Episode episode : person.getEpisodes()) {
                count += episode.getEvents(table).size();
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Timeline timeline = (Timeline) o;
        return new ArrayList<>(persons.values()).equals(new ArrayList<>(timeline.persons.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(persons.keySet());
    }
}
