package org.ohnlp.cdm.timeline.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An individual and their episodes in encounter order.
 */
public class Person implements Serializable {
    private static final long serialVersionUID = 1L;

    private String personId;
    private DateTime birthDatetime;
    private DateTime deathDatetime;
    private String gender;
    private String ethnicity;
    private LinkedHashMap<String, Episode> episodes = new LinkedHashMap<>();

    public Person() {}

    public Person(String personId, DateTime birthDatetime, DateTime deathDatetime, String gender, String ethnicity) {
        this.personId = personId;
        this.birthDatetime = birthDatetime;
        this.deathDatetime = deathDatetime;
        this.gender = gender;
        this.ethnicity = ethnicity;
    }

    public void addEpisode(Episode episode) {
        if (!personId.equals(episode.getPersonId())) {
            throw new IllegalArgumentException("Episode " + episode.getEpisodeId() + " belongs to person "
                    + episode.getPersonId() + ", not " + personId);
        }
        if (episodes.containsKey(episode.getEpisodeId())) {
            throw new IllegalArgumentException("Duplicate episode " + episode.getEpisodeId() + " on person " + personId);
        }
        episode.setPerson(this);
        episodes.put(episode.getEpisodeId(), episode);
    }

    public Episode getEpisode(String episodeId) {
        return episodes.get(episodeId);
    }

    public List<Episode> getEpisodes() {
        return Collections.unmodifiableList(new ArrayList<>(episodes.values()));
    }

    public int getEpisodeCount() {
        return episodes.size();
    }

    public List<String> getAvailableTables() {
        List<String> ret = new ArrayList<>();
        for (Episode episode : episodes.values()) {
            for (String table : episode.getAvailableTables()) {
                if (!ret.contains(table)) {
                    ret.add(table);
                }
            }
        }
        return ret;
    }

    public String getPersonId() {
        return personId;
    }

    public DateTime getBirthDatetime() {
        return birthDatetime;
    }

    public DateTime getDeathDatetime() {
        return deathDatetime;
    }

    public String getGender() {
        return gender;
    }

    public String getEthnicity() {
        return ethnicity;
    }

    Map<String, Episode> episodeIndex() {
        return episodes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person person = (Person) o;
        return Objects.equals(personId, person.personId)
                && Objects.equals(birthDatetime, person.birthDatetime)
                && Objects.equals(deathDatetime, person.deathDatetime)
                && Objects.equals(gender, person.gender)
                && Objects.equals(ethnicity, person.ethnicity)
                // Episode order is part of the timeline
                && new ArrayList<>(episodes.values()).equals(new ArrayList<>(person.episodes.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(personId, birthDatetime, deathDatetime, gender, ethnicity);
    }

    @Override
    public String toString() {
        return "Person{" + personId + ", born " + birthDatetime + ", episodes=" + episodes.size() + "}";
    }
}
