package org.ohnlp.cdm.timeline.exceptions;

import java.nio.file.Path;

/**
 * The cached artifact for a run configuration could not be decoded. Rebuild with refreshCache set.
 */
public class CacheCorruptionException extends TimelineException {
    private final Path artifact;

    public CacheCorruptionException(Path artifact, Throwable cause) {
        super("Cached timeline at " + artifact + " is unreadable, rerun with refreshCache=true", cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
