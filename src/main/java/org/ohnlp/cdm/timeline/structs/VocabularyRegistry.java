package org.ohnlp.cdm.timeline.structs;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks the vocabulary currently in effect for each table's event codes.
 * <p>
 * When a table receives events from more than one source vocabulary, {@link #getVocabulary(String)} reports only
 * the target of the last mapping applied; {@link #getTransitions(String)} keeps every distinct transition in the
 * order it was first applied.
 */
public class VocabularyRegistry implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, String> active = new LinkedHashMap<>();
    private final LinkedHashMap<String, List<Transition>> transitions = new LinkedHashMap<>();

    public VocabularyRegistry() {}

    public VocabularyRegistry(VocabularyRegistry other) {
        this.active.putAll(other.active);
        other.transitions.forEach((k, v) -> this.transitions.put(k, new ArrayList<>(v)));
    }

    /**
     * Records the vocabulary a table is parsed in. Does nothing if the table is already registered.
     */
    public void register(String table, String vocabulary) {
        active.putIfAbsent(table, vocabulary);
    }

    public void recordMapping(String table, String sourceVocabulary, String targetVocabulary) {
        active.put(table, targetVocabulary);
        Transition transition = new Transition(sourceVocabulary, targetVocabulary);
        List<Transition> history = transitions.computeIfAbsent(table, k -> new ArrayList<>());
        if (!history.contains(transition)) {
            history.add(transition);
        }
    }

    public String getVocabulary(String table) {
        return active.get(table);
    }

    public List<Transition> getTransitions(String table) {
        return Collections.unmodifiableList(transitions.getOrDefault(table, Collections.emptyList()));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(active);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VocabularyRegistry that = (VocabularyRegistry) o;
        return active.equals(that.active) && transitions.equals(that.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(active, transitions);
    }

    @Override
    public String toString() {
        return active.toString();
    }

    public static class Transition implements Serializable {
        private static final long serialVersionUID = 1L;

        private final String source;
        private final String target;

        public Transition(String source, String target) {
            this.source = source;
            this.target = target;
        }

        public String getSource() {
            return source;
        }

        public String getTarget() {
            return target;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Transition that = (Transition) o;
            return source.equals(that.source) && target.equals(that.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, target);
        }

        @Override
        public String toString() {
            return source + " -> " + target;
        }
    }
}
