package com.di.featurenova.pipeline.artifact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArtifactLayout Tests")
class ArtifactLayoutTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Should format run ids as MM_dd_yyyy_HH_mm_ss")
    void testRunIdFormat() {
        assertEquals("03_07_2025_14_05_09", ArtifactLayout.runIdFor(LocalDateTime.of(2025, 3, 7, 14, 5, 9)));
    }

    @Test
    @DisplayName("Should place every artifact under its stage directory")
    void testPaths() {
        ArtifactLayout layout = ArtifactLayout.of(root, "run1", "phishing.csv");
        Path run = root.resolve("run1");

        assertEquals(run, layout.runDirectory());
        assertEquals(run.resolve("data_ingestion/feature_store/phishing.csv"), layout.featureStoreFile());
        assertEquals(run.resolve("data_ingestion/ingested/train.csv"), layout.ingestedTrainFile());
        assertEquals(run.resolve("data_ingestion/ingested/test.csv"), layout.ingestedTestFile());
        assertEquals(run.resolve("data_validation/validated/train.csv"), layout.validatedTrainFile());
        assertEquals(run.resolve("data_validation/validated/test.csv"), layout.validatedTestFile());
        assertEquals(run.resolve("data_validation/drift_report/report.yaml"), layout.driftReportFile());
        assertEquals(run.resolve("data_transformation/transformed/train.npy"), layout.transformedTrainFile());
        assertEquals(run.resolve("data_transformation/transformed/test.npy"), layout.transformedTestFile());
        assertEquals(run.resolve("data_transformation/transformed_object/preprocessor.json"), layout.preprocessorFile());
    }

    @Test
    @DisplayName("Path accessors should not touch the file system")
    void testAccessorsArePure() {
        ArtifactLayout layout = ArtifactLayout.of(root, "run1");
        layout.preprocessorFile();
        assertFalse(Files.exists(layout.runDirectory()));
    }

    @Test
    @DisplayName("Should create the run tree idempotently")
    void testCreateRunTree() {
        ArtifactLayout layout = ArtifactLayout.of(root, "run1").createRunTree();
        layout.createRunTree();

        assertTrue(Files.isDirectory(layout.featureStoreFile().getParent()));
        assertTrue(Files.isDirectory(layout.validatedTrainFile().getParent()));
        assertTrue(Files.isDirectory(layout.driftReportFile().getParent()));
        assertTrue(Files.isDirectory(layout.preprocessorFile().getParent()));
    }

    @Test
    @DisplayName("Should relativize and resolve paths inside the run directory")
    void testRelativizeResolve() {
        ArtifactLayout layout = ArtifactLayout.of(root, "run1");
        String rel = layout.relativize(layout.ingestedTrainFile());

        assertEquals("data_ingestion/ingested/train.csv", rel);
        assertEquals(layout.ingestedTrainFile(), layout.resolve(rel));
    }

    @Test
    @DisplayName("Should reject paths escaping the run directory")
    void testEscapingPaths() {
        ArtifactLayout layout = ArtifactLayout.of(root, "run1");
        assertThrows(IllegalArgumentException.class, () -> layout.resolve("../run2/secret.csv"));
        assertThrows(IllegalArgumentException.class, () -> layout.relativize(root.resolve("other.csv")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "..", ".", "a/b", "a\\b"})
    @DisplayName("Should reject run ids that are not a single path segment")
    void testInvalidRunIds(String runId) {
        assertThrows(IllegalArgumentException.class, () -> ArtifactLayout.of(root, runId));
    }

    @Test
    @DisplayName("Should rebuild the layout from a run directory")
    void testOfRunDirectory() {
        ArtifactLayout layout = ArtifactLayout.ofRunDirectory(root.resolve("run7"));
        assertEquals("run7", layout.runId());
        assertEquals(root.toAbsolutePath().normalize(), layout.baseDirectory());
    }
}
