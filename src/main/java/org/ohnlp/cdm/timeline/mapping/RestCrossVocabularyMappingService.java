package org.ohnlp.cdm.timeline.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.springframework.http.client.support.BasicAuthenticationInterceptor;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a remote mapping endpoint: {@code POST /_map} with the code and options, answered by a JSON array of codes.
 */
public class RestCrossVocabularyMappingService implements CrossVocabularyMappingService {
    private final RestTemplate mappingServer;

    public RestCrossVocabularyMappingService(RestTemplate mappingServer) {
        this.mappingServer = mappingServer;
    }

    /**
     * @param node Configuration with url and optionally user and password
     */
    public static RestCrossVocabularyMappingService fromConfig(JsonNode node) {
        if (node == null || !node.hasNonNull("url")) {
            throw new ConfigurationException("Mapping service requires a url");
        }
        RestTemplate template = new RestTemplate();
        template.setUriTemplateHandler(new DefaultUriBuilderFactory(node.get("url").asText()));
        if (node.has("user")) {
            template.setInterceptors(Collections.singletonList(
                    new BasicAuthenticationInterceptor(
                            node.get("user").asText(),
                            node.path("password").asText())));
        }
        return new RestCrossVocabularyMappingService(template);
    }

    @Override
    public List<String> map(String sourceVocabulary, String targetVocabulary, String code,
                            Map<String, Object> sourceOptions, Map<String, Object> targetOptions) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("source_vocabulary", sourceVocabulary);
        request.put("target_vocabulary", targetVocabulary);
        request.put("code", code);
        request.put(CodeMappingConfig.SOURCE_KWARGS, sourceOptions);
        request.put(CodeMappingConfig.TARGET_KWARGS, targetOptions);
        String[] codes = mappingServer.postForObject("/_map", request, String[].class);
        return codes == null ? Collections.emptyList() : Arrays.asList(codes);
    }
}
