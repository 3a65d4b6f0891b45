package org.ohnlp.cdm.timeline.mapping;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Target vocabulary of a mapping plus the options forwarded verbatim to the mapping service.
 */
public class CodeMappingTarget implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String targetVocabulary;
    private final Map<String, Object> sourceOptions;
    private final Map<String, Object> targetOptions;

    public CodeMappingTarget(String targetVocabulary) {
        this(targetVocabulary, Collections.emptyMap(), Collections.emptyMap());
    }

    public CodeMappingTarget(String targetVocabulary, Map<String, Object> sourceOptions,
                             Map<String, Object> targetOptions) {
        this.targetVocabulary = Objects.requireNonNull(targetVocabulary, "targetVocabulary");
        this.sourceOptions = Collections.unmodifiableMap(new LinkedHashMap<>(sourceOptions));
        this.targetOptions = Collections.unmodifiableMap(new LinkedHashMap<>(targetOptions));
    }

    public String getTargetVocabulary() {
        return targetVocabulary;
    }

    public Map<String, Object> getSourceOptions() {
        return sourceOptions;
    }

    public Map<String, Object> getTargetOptions() {
        return targetOptions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CodeMappingTarget that = (CodeMappingTarget) o;
        return targetVocabulary.equals(that.targetVocabulary)
                && sourceOptions.equals(that.sourceOptions)
                && targetOptions.equals(that.targetOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetVocabulary, sourceOptions, targetOptions);
    }

    @Override
    public String toString() {
        if (sourceOptions.isEmpty() && targetOptions.isEmpty()) {
            return targetVocabulary;
        }
        return "(" + targetVocabulary + ", source_kwargs=" + sourceOptions + ", target_kwargs=" + targetOptions + ")";
    }
}
