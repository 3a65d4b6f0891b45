package org.ohnlp.cdm.timeline.cache;

import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.ohnlp.cdm.timeline.exceptions.CacheCorruptionException;
import org.ohnlp.cdm.timeline.exceptions.TimelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores one {@link TimelineSnapshot} per {@link CacheKey} as {@code {key}.timeline} under a directory.
 * <p>
 * Writers are not coordinated; concurrent runs sharing a key must serialize their writes themselves.
 */
public class TimelineCache {
    private static final Logger LOG = LoggerFactory.getLogger(TimelineCache.class);

    static final String EXTENSION = ".timeline";

    private final Path directory;
    private final Coder<TimelineSnapshot> coder = SerializableCoder.of(TimelineSnapshot.class);

    public TimelineCache(Path directory) {
        this.directory = directory;
    }

    public Path pathFor(CacheKey key) {
        return directory.resolve(key.getHash() + EXTENSION);
    }

    public boolean contains(CacheKey key) {
        return Files.isRegularFile(pathFor(key));
    }

    /**
     * @return the cached snapshot, or empty if nothing is stored under the key
     * @throws CacheCorruptionException if an artifact exists but cannot be decoded
     */
    public Optional<TimelineSnapshot> read(CacheKey key) {
        Path file = pathFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            TimelineSnapshot snapshot = coder.decode(in);
            if (snapshot == null || snapshot.getTimeline() == null || snapshot.getRegistry() == null) {
                throw new IOException("Incomplete snapshot");
            }
            LOG.debug("Loaded cached timeline from {}", file);
            return Optional.of(snapshot);
        } catch (IOException | RuntimeException e) {
            throw new CacheCorruptionException(file, e);
        }
    }

    public void write(CacheKey key, TimelineSnapshot snapshot) {
        Path file = pathFor(key);
        try {
            Files.createDirectories(directory);
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
                coder.encode(snapshot, out);
            }
        } catch (IOException e) {
            throw new TimelineException("Failed to write cached timeline to " + file, e);
        }
        LOG.debug("Saved timeline to {}", file);
    }

    public Path getDirectory() {
        return directory;
    }
}
