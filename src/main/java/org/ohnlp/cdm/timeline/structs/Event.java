package org.ohnlp.cdm.timeline.structs;

import org.joda.time.DateTime;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single coded clinical record belonging to one episode of one person.
 */
public class Event implements Serializable {
    private static final long serialVersionUID = 1L;

    private String code;
    private String vocabulary;
    private String table;
    private String episodeId;
    private String personId;
    private DateTime timestamp;
    private Map<String, String> attributes;

    public Event() {}

    public Event(String code, String vocabulary, String table, String episodeId, String personId, DateTime timestamp) {
        this(code, vocabulary, table, episodeId, personId, timestamp, Collections.emptyMap());
    }

    public Event(String code, String vocabulary, String table, String episodeId, String personId,
                 DateTime timestamp, Map<String, String> attributes) {
        this.code = code;
        this.vocabulary = vocabulary;
        this.table = table;
        this.episodeId = episodeId;
        this.personId = personId;
        this.timestamp = timestamp;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    /**
     * @return a copy of this event carrying a different code in a different vocabulary, every other field kept
     */
    public Event withCode(String code, String vocabulary) {
        return new Event(code, vocabulary, table, episodeId, personId, timestamp, attributes);
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getVocabulary() {
        return vocabulary;
    }

    public void setVocabulary(String vocabulary) {
        this.vocabulary = vocabulary;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getEpisodeId() {
        return episodeId;
    }

    public void setEpisodeId(String episodeId) {
        this.episodeId = episodeId;
    }

    public String getPersonId() {
        return personId;
    }

    public void setPersonId(String personId) {
        this.personId = personId;
    }

    public DateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(DateTime timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return Objects.equals(code, event.code)
                && Objects.equals(vocabulary, event.vocabulary)
                && Objects.equals(table, event.table)
                && Objects.equals(episodeId, event.episodeId)
                && Objects.equals(personId, event.personId)
                && Objects.equals(timestamp, event.timestamp)
                && Objects.equals(attributes, event.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, vocabulary, table, episodeId, personId, timestamp, attributes);
    }

    @Override
    public String toString() {
        return "Event{" + table + ": " + vocabulary + "/" + code + " @ " + timestamp
                + ", person=" + personId + ", episode=" + episodeId + "}";
    }
}
