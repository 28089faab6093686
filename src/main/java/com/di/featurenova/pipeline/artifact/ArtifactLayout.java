package com.di.featurenova.pipeline.artifact;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Run-scoped artifact directory tree.
 *
 * <pre>
 *   &lt;base&gt;/&lt;run-id&gt;/
 *     data_ingestion/feature_store/&lt;feature-store-file&gt;
 *     data_ingestion/ingested/{train,test}.csv
 *     data_validation/validated/{train,test}.csv
 *     data_validation/drift_report/report.yaml
 *     data_transformation/transformed/{train,test}.npy
 *     data_transformation/transformed_object/preprocessor.json
 * </pre>
 *
 * <p>Every path accessor is a pure function of the base directory and the run
 * id; only {@link #createRunTree()} touches the file system.
 */
public final class ArtifactLayout {

    /** Run ids default to the run start time in this format. */
    public static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("MM_dd_yyyy_HH_mm_ss");

    public static final String DEFAULT_FEATURE_STORE_FILE = "feature_store.csv";

    static final String INGESTION_DIR       = "data_ingestion";
    static final String VALIDATION_DIR      = "data_validation";
    static final String TRANSFORMATION_DIR  = "data_transformation";

    private final Path   baseDirectory;
    private final String runId;
    private final String featureStoreFileName;

    private ArtifactLayout(Path baseDirectory, String runId, String featureStoreFileName) {
        this.baseDirectory        = Objects.requireNonNull(baseDirectory, "baseDirectory");
        this.runId                = requireSegment(runId, "runId");
        this.featureStoreFileName = requireSegment(featureStoreFileName, "featureStoreFileName");
    }

    public static ArtifactLayout of(Path baseDirectory, String runId) {
        return new ArtifactLayout(baseDirectory, runId, DEFAULT_FEATURE_STORE_FILE);
    }

    public static ArtifactLayout of(Path baseDirectory, String runId, String featureStoreFileName) {
        return new ArtifactLayout(baseDirectory, runId, featureStoreFileName);
    }

    /** Rebuilds the layout of an existing run from its run directory. */
    public static ArtifactLayout ofRunDirectory(Path runDirectory) {
        Path abs = runDirectory.toAbsolutePath().normalize();
        if (abs.getParent() == null || abs.getFileName() == null) {
            throw new IllegalArgumentException("Not a run directory: " + runDirectory);
        }
        return new ArtifactLayout(abs.getParent(), abs.getFileName().toString(), DEFAULT_FEATURE_STORE_FILE);
    }

    public static String runIdFor(LocalDateTime startedAt) {
        return RUN_ID_FORMAT.format(startedAt);
    }

    public Path baseDirectory()  { return baseDirectory; }
    public String runId()        { return runId; }
    public Path runDirectory()   { return baseDirectory.resolve(runId); }

    // ---- ingestion ----------------------------------------------------------

    public Path featureStoreFile() {
        return ingestionDir().resolve("feature_store").resolve(featureStoreFileName);
    }

    public Path ingestedTrainFile() { return ingestionDir().resolve("ingested").resolve("train.csv"); }
    public Path ingestedTestFile()  { return ingestionDir().resolve("ingested").resolve("test.csv"); }

    // ---- validation ---------------------------------------------------------

    public Path validatedTrainFile() { return validationDir().resolve("validated").resolve("train.csv"); }
    public Path validatedTestFile()  { return validationDir().resolve("validated").resolve("test.csv"); }
    public Path driftReportFile()    { return validationDir().resolve("drift_report").resolve("report.yaml"); }

    // ---- transformation -----------------------------------------------------

    public Path transformedTrainFile() { return transformationDir().resolve("transformed").resolve("train.npy"); }
    public Path transformedTestFile()  { return transformationDir().resolve("transformed").resolve("test.npy"); }

    public Path preprocessorFile() {
        return transformationDir().resolve("transformed_object").resolve("preprocessor.json");
    }

    // ---- helpers ------------------------------------------------------------

    /** Path of {@code file} relative to the run directory, as stored in stage metadata. */
    public String relativize(Path file) {
        Path rel = runDirectory().toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize());
        if (rel.startsWith("..")) {
            throw new IllegalArgumentException(file + " is outside run directory " + runDirectory());
        }
        return rel.toString().replace('\\', '/');
    }

    /** Inverse of {@link #relativize(Path)}. */
    public Path resolve(String relativePath) {
        Path resolved = runDirectory().resolve(relativePath).normalize();
        if (!resolved.startsWith(runDirectory().normalize())) {
            throw new IllegalArgumentException(relativePath + " escapes run directory " + runDirectory());
        }
        return resolved;
    }

    /**
     * Creates every stage directory of the run if absent. Existing directories
     * and files are left untouched.
     */
    public ArtifactLayout createRunTree() {
        List<Path> dirs = List.of(
                featureStoreFile().getParent(),
                ingestedTrainFile().getParent(),
                validatedTrainFile().getParent(),
                driftReportFile().getParent(),
                transformedTrainFile().getParent(),
                preprocessorFile().getParent());
        try {
            for (Path dir : dirs) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create artifact run tree " + runDirectory(), e);
        }
        return this;
    }

    private Path ingestionDir()      { return runDirectory().resolve(INGESTION_DIR); }
    private Path validationDir()     { return runDirectory().resolve(VALIDATION_DIR); }
    private Path transformationDir() { return runDirectory().resolve(TRANSFORMATION_DIR); }

    private static String requireSegment(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        if (value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException(what + " must be a single path segment: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ArtifactLayout[" + runDirectory() + "]";
    }
}
