package org.ohnlp.cdm.timeline.cache;

import org.ohnlp.cdm.timeline.mapping.CodeMappingConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Content hash of every run input that changes the assembled timeline.
 */
public final class CacheKey {
    /**
     * Bump whenever the persisted layout of {@link TimelineSnapshot} or the model classes changes.
     */
    public static final int FORMAT_VERSION = 1;

    private final String canonical;
    private final String hash;

    private CacheKey(String canonical) {
        this.canonical = canonical;
        this.hash = sha256(canonical);
    }

    /**
     * @param datasetName Name of the dataset
     * @param source Data connection description, a root directory or JDBC url
     * @param tables Requested clinical tables, in any order
     * @param codeMapping Code mapping configuration
     * @param personRowLimit Person row cap in development mode, null when the whole cohort is read
     */
    public static CacheKey of(String datasetName, String source, Collection<String> tables,
                              CodeMappingConfig codeMapping, Integer personRowLimit) {
        List<String> sortedTables = new ArrayList<>();
        for (String table : tables) {
            sortedTables.add(table.toLowerCase(Locale.ROOT));
        }
        Collections.sort(sortedTables);
        List<String> parts = new ArrayList<>();
        parts.add("v" + FORMAT_VERSION);
        parts.add(datasetName);
        parts.add(source);
        parts.addAll(sortedTables);
        parts.add(codeMapping.toCanonicalString());
        parts.add(personRowLimit == null ? "prod" : "dev" + personRowLimit);
        return new CacheKey(String.join("+", parts));
    }

    public String getHash() {
        return hash;
    }

    public String getCanonical() {
        return canonical;
    }

    private static String sha256(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CacheKey && hash.equals(((CacheKey) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return hash;
    }
}
