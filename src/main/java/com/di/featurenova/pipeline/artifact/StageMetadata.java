package com.di.featurenova.pipeline.artifact;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * The only channel between stages: a small JSON-serialisable record of file
 * paths, boolean flags and short status strings. Never carries data.
 *
 * <p>Paths are stored relative to {@link #getRunDirectory()} so a run tree can
 * be moved as a whole.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StageMetadata {

    /** Producing stage ({@code ingestion}, {@code validation}, {@code transformation}). */
    String stage;

    /** Absolute run directory the relative paths resolve against. */
    String runDirectory;

    @Singular
    Map<String, String> paths;

    @Singular
    Map<String, Boolean> flags;

    @Singular
    Map<String, String> attributes;

    public ArtifactLayout layout() {
        if (runDirectory == null || runDirectory.isBlank()) {
            throw new IllegalArgumentException("Stage metadata from '" + stage + "' has no run directory");
        }
        return ArtifactLayout.ofRunDirectory(Paths.get(runDirectory));
    }

    /** Resolves a required path entry against the run directory. */
    public Path path(String key) {
        String rel = paths.get(key);
        if (rel == null || rel.isBlank()) {
            throw new IllegalArgumentException(
                    "Stage metadata from '" + stage + "' has no path '" + key + "' (have " + paths.keySet() + ")");
        }
        return layout().resolve(rel);
    }

    /** Missing flags read as {@code false}. */
    public boolean flag(String key) {
        return Boolean.TRUE.equals(flags.get(key));
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
