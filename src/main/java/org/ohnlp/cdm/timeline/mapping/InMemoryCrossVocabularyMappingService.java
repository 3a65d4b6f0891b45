package org.ohnlp.cdm.timeline.mapping;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Code tables held in memory, one per (source, target) vocabulary pair. Options are ignored.
 */
public class InMemoryCrossVocabularyMappingService implements CrossVocabularyMappingService {
    private final Map<String, Map<String, List<String>>> tables = new HashMap<>();

    public InMemoryCrossVocabularyMappingService put(String sourceVocabulary, String targetVocabulary,
                                                     String code, String... targets) {
        List<String> codes = table(sourceVocabulary, targetVocabulary).computeIfAbsent(code, k -> new ArrayList<>());
        Collections.addAll(codes, targets);
        return this;
    }

    /**
     * Loads a delimited file with a header and the columns source_code and target_code. A source code appearing on
     * several lines maps to every target, in file order.
     */
    public InMemoryCrossVocabularyMappingService load(String sourceVocabulary, String targetVocabulary,
                                                      Path file, String delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .build();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            if (!parser.getHeaderMap().containsKey("source_code") || !parser.getHeaderMap().containsKey("target_code")) {
                throw new ConfigurationException("Code table " + file + " needs source_code and target_code columns");
            }
            for (CSVRecord record : parser) {
                put(sourceVocabulary, targetVocabulary, record.get("source_code"), record.get("target_code"));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load code table " + file, e);
        }
        return this;
    }

    @Override
    public List<String> map(String sourceVocabulary, String targetVocabulary, String code,
                            Map<String, Object> sourceOptions, Map<String, Object> targetOptions) {
        Map<String, List<String>> table = tables.get(key(sourceVocabulary, targetVocabulary));
        if (table == null) {
            throw new IllegalStateException("No code table loaded for " + sourceVocabulary + " -> " + targetVocabulary);
        }
        return Collections.unmodifiableList(table.getOrDefault(code, Collections.emptyList()));
    }

    private Map<String, List<String>> table(String sourceVocabulary, String targetVocabulary) {
        return tables.computeIfAbsent(key(sourceVocabulary, targetVocabulary), k -> new HashMap<>());
    }

    private static String key(String sourceVocabulary, String targetVocabulary) {
        return sourceVocabulary + "_" + targetVocabulary;
    }
}
