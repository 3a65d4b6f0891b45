package org.ohnlp.cdm.timeline.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;

import java.io.Serializable;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Source vocabulary to {@link CodeMappingTarget} configuration.
 * <p>
 * JSON form, one entry per source vocabulary:
 * <pre>
 * {
 *   "ICD9CM": "ICD10CM",
 *   "NDC": ["ATC", {"target_kwargs": {"level": 3}}]
 * }
 * </pre>
 * The options object may only hold {@code source_kwargs} and {@code target_kwargs}.
 */
public class CodeMappingConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String SOURCE_KWARGS = "source_kwargs";
    public static final String TARGET_KWARGS = "target_kwargs";
    private static final Set<String> OPTION_KEYS = Set.of(SOURCE_KWARGS, TARGET_KWARGS);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final LinkedHashMap<String, CodeMappingTarget> mappings = new LinkedHashMap<>();

    public static CodeMappingConfig empty() {
        return new CodeMappingConfig();
    }

    public CodeMappingConfig map(String sourceVocabulary, String targetVocabulary) {
        return map(sourceVocabulary, new CodeMappingTarget(targetVocabulary));
    }

    public CodeMappingConfig map(String sourceVocabulary, CodeMappingTarget target) {
        mappings.put(sourceVocabulary, target);
        return this;
    }

    /**
     * @param options Options bag holding at most source_kwargs and target_kwargs
     * @throws ConfigurationException on any other key
     */
    public CodeMappingConfig map(String sourceVocabulary, String targetVocabulary, Map<String, Map<String, Object>> options) {
        for (String key : options.keySet()) {
            if (!OPTION_KEYS.contains(key)) {
                throw new ConfigurationException("Unsupported option " + key + " for code mapping of "
                        + sourceVocabulary + ", expected only " + SOURCE_KWARGS + " or " + TARGET_KWARGS);
            }
        }
        return map(sourceVocabulary, new CodeMappingTarget(targetVocabulary,
                options.getOrDefault(SOURCE_KWARGS, Collections.emptyMap()),
                options.getOrDefault(TARGET_KWARGS, Collections.emptyMap())));
    }

    public static CodeMappingConfig fromJson(JsonNode node) {
        CodeMappingConfig config = new CodeMappingConfig();
        if (node == null || node.isNull()) {
            return config;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Code mapping must be a JSON object, got " + node.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String source = e.getKey();
            JsonNode value = e.getValue();
            if (value.isTextual()) {
                config.map(source, value.asText());
            } else if (value.isArray() && value.size() == 2 && value.get(0).isTextual() && value.get(1).isObject()) {
                Map<String, Map<String, Object>> options;
                try {
                    options = CANONICAL.convertValue(value.get(1), new TypeReference<Map<String, Map<String, Object>>>() {});
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("Options for code mapping of " + source
                            + " must map " + SOURCE_KWARGS + " and " + TARGET_KWARGS + " to objects", ex);
                }
                config.map(source, value.get(0).asText(), options);
            } else {
                throw new ConfigurationException("Code mapping for " + source
                        + " must be a target vocabulary or a [target vocabulary, options] pair");
            }
        }
        return config;
    }

    public CodeMappingTarget getTarget(String sourceVocabulary) {
        return mappings.get(sourceVocabulary);
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public Map<String, CodeMappingTarget> asMap() {
        return Collections.unmodifiableMap(mappings);
    }

    /**
     * @return the entries sorted by source vocabulary as JSON with sorted keys, identical for equal configurations
     */
    public String toCanonicalString() {
        Map<String, Object> sorted = new TreeMap<>();
        mappings.forEach((source, target) -> sorted.put(source, List.of(
                target.getTargetVocabulary(),
                Map.of(SOURCE_KWARGS, target.getSourceOptions(), TARGET_KWARGS, target.getTargetOptions()))));
        try {
            return CANONICAL.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Code mapping options must be JSON serializable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return mappings.equals(((CodeMappingConfig) o).mappings);
    }

    @Override
    public int hashCode() {
        return mappings.hashCode();
    }

    @Override
    public String toString() {
        return mappings.toString();
    }
}
