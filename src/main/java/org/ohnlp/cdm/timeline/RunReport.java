package org.ohnlp.cdm.timeline;

import org.ohnlp.cdm.timeline.concurrent.UnitFailure;
import org.ohnlp.cdm.timeline.ehr.EventAttacher.AttachmentReport;
import org.ohnlp.cdm.timeline.mapping.VocabularyMapper.MappingReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data quality signals of one build. Empty when the timeline came from the cache.
 */
public class RunReport {
    private final Map<String, AttachmentReport> attachments = new LinkedHashMap<>();
    private final List<UnitFailure> unitFailures = new ArrayList<>();
    private MappingReport mapping;

    void addAttachment(AttachmentReport report) {
        attachments.put(report.getTable(), report);
    }

    void addUnitFailures(List<UnitFailure> failures) {
        unitFailures.addAll(failures);
    }

    void setMapping(MappingReport mapping) {
        this.mapping = mapping;
    }

    public Map<String, AttachmentReport> getAttachments() {
        return Collections.unmodifiableMap(attachments);
    }

    public AttachmentReport getAttachment(String table) {
        return attachments.get(table);
    }

    /**
     * @return events dropped across all tables because their person or episode was unknown
     */
    public long getDroppedEvents() {
        return attachments.values().stream().mapToLong(AttachmentReport::getDropped).sum();
    }

    public List<UnitFailure> getUnitFailures() {
        return Collections.unmodifiableList(unitFailures);
    }

    public MappingReport getMapping() {
        return mapping;
    }
}
