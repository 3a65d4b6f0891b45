package org.ohnlp.cdm.timeline.cache;

import org.ohnlp.cdm.timeline.structs.Timeline;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;

import java.io.Serializable;
import java.util.Objects;

/**
 * What gets persisted per cache key: the mapped timeline and the vocabularies its tables are coded in.
 */
public class TimelineSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Timeline timeline;
    private final VocabularyRegistry registry;

    public TimelineSnapshot(Timeline timeline, VocabularyRegistry registry) {
        this.timeline = timeline;
        this.registry = registry;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    public VocabularyRegistry getRegistry() {
        return registry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimelineSnapshot that = (TimelineSnapshot) o;
        return Objects.equals(timeline, that.timeline) && Objects.equals(registry, that.registry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeline, registry);
    }
}
