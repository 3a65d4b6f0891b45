package org.ohnlp.cdm.timeline.mapping;

import java.util.List;
import java.util.Map;

/**
 * Translates a code from one vocabulary into zero or more codes of another.
 */
public interface CrossVocabularyMappingService {
    /**
     * @param sourceVocabulary Vocabulary the code belongs to
     * @param targetVocabulary Vocabulary to translate into
     * @param code The code to translate
     * @param sourceOptions Source-side options from the code mapping configuration, possibly empty
     * @param targetOptions Target-side options from the code mapping configuration, possibly empty
     * @return translated codes in preference order; empty if the code has no counterpart
     */
    List<String> map(String sourceVocabulary, String targetVocabulary, String code,
                     Map<String, Object> sourceOptions, Map<String, Object> targetOptions);
}
