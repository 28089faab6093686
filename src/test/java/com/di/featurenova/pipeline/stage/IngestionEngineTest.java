package com.di.featurenova.pipeline.stage;

import com.di.featurenova.config.IngestionConfig;
import com.di.featurenova.pipeline.artifact.ArtifactLayout;
import com.di.featurenova.pipeline.artifact.StageMetadata;
import com.di.featurenova.pipeline.error.IngestionException;
import com.di.featurenova.pipeline.schema.SchemaSpec;
import com.di.featurenova.pipeline.source.ListRecordSource;
import com.di.featurenova.pipeline.source.SourceRecord;
import com.di.featurenova.pipeline.table.ColumnKind;
import com.di.featurenova.pipeline.table.FeatureTable;
import com.di.featurenova.pipeline.table.FeatureTableCsv;
import com.di.featurenova.util.PipelineMetrics;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.di.featurenova.pipeline.artifact.StageMetadataKeys.*;
import static com.di.featurenova.pipeline.source.ListRecordSource.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionEngine Tests")
class IngestionEngineTest {

    private static final SchemaSpec SCHEMA = SchemaSpec.of(List.of("A", "B", "color", "target"), "target", List.of("A"));

    @TempDir
    Path tempDir;

    private PipelineMetrics metrics;
    private IngestionEngine engine;
    private ArtifactLayout  layout;

    @BeforeEach
    void setUp() {
        metrics = PipelineMetrics.standalone();
        engine  = new IngestionEngine(new IngestionConfig(7, Duration.ofSeconds(5), 0.2, 42L), metrics);
        layout  = ArtifactLayout.of(tempDir, "10_19_2026_12_00_00");
    }

    /** 50 rows, 40 of class 0 and 10 of class 1. */
    static List<SourceRecord> records() {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            records.add(record("A", i % 3 == 0 ? null : i * 0.5, "B", i, "color", i % 2 == 0 ? "red" : "blue",
                    "target", i % 5 == 0 ? 1 : 0));
        }
        return records;
    }

    private double failures() {
        Counter counter = metrics.registry().find("featurenova.stage.failures").tag("stage", "ingestion").counter();
        return counter == null ? 0.0 : counter.count();
    }

    // =========================================================================
    // Success path
    // =========================================================================

    @Test
    @DisplayName("Should write the feature store and a stratified split")
    void testIngest_Success() throws IOException {
        ListRecordSource source = new ListRecordSource(records());

        IngestionArtifact artifact = engine.ingest(source, SCHEMA, layout);

        assertEquals(50, artifact.rowCount());
        assertEquals(40, artifact.trainRows());
        assertEquals(10, artifact.testRows());
        assertEquals(Map.of("0", 32, "1", 8), artifact.trainClassCounts());
        assertEquals(Map.of("0", 8, "1", 2), artifact.testClassCounts());
        assertTrue(Files.isRegularFile(layout.featureStoreFile()));

        FeatureTable store = FeatureTableCsv.read(layout.featureStoreFile());
        FeatureTable train = FeatureTableCsv.read(layout.ingestedTrainFile());
        FeatureTable test  = FeatureTableCsv.read(layout.ingestedTestFile());
        assertEquals(List.of("A", "B", "color", "target"), store.columns());
        assertEquals(store.columns(), train.columns());
        assertEquals(store.columns(), test.columns());
        assertEquals(50, store.rowCount());
        assertEquals(50, train.rowCount() + test.rowCount());
    }

    @Test
    @DisplayName("Should read in bounded batches and close the cursor but not the source")
    void testIngest_Batches() {
        ListRecordSource source = new ListRecordSource(records());

        engine.ingest(source, SCHEMA, layout);

        assertEquals(List.of(7, 7, 7, 7, 7, 7, 7, 1, 0), source.batchSizes());
        assertEquals(1, source.cursorsClosed());
        assertFalse(source.isClosed());
        assertEquals(8.0, metrics.registry().get("featurenova.ingestion.batches").counter().count());
    }

    @Test
    @DisplayName("Should return metadata with run-relative paths")
    void testRun_Metadata() {
        StageMetadata metadata = engine.run(new ListRecordSource(records()), SCHEMA, layout);

        assertEquals(STAGE_INGESTION, metadata.getStage());
        assertEquals(layout.runDirectory().toAbsolutePath().toString(), metadata.getRunDirectory());
        assertEquals("data_ingestion/ingested/train.csv", metadata.getPaths().get(TRAIN_PATH));
        assertEquals("data_ingestion/ingested/test.csv", metadata.getPaths().get(TEST_PATH));
        assertEquals("data_ingestion/feature_store/feature_store.csv", metadata.getPaths().get(FEATURE_STORE_PATH));
        assertEquals(layout.ingestedTestFile(), metadata.path(TEST_PATH));
        assertEquals("50", metadata.attribute(ROW_COUNT));
    }

    @Test
    @DisplayName("Should produce identical partitions for the same seed")
    void testIngest_Deterministic() throws IOException {
        ArtifactLayout other = ArtifactLayout.of(tempDir, "other");
        engine.ingest(new ListRecordSource(records()), SCHEMA, layout);
        engine.ingest(new ListRecordSource(records()), SCHEMA, other);

        assertEquals(-1L, Files.mismatch(layout.ingestedTrainFile(), other.ingestedTrainFile()));
        assertEquals(-1L, Files.mismatch(layout.ingestedTestFile(), other.ingestedTestFile()));
    }

    @Test
    @DisplayName("Should record the column kinds resolved at ingestion next to the partitions")
    void testIngest_ColumnKinds() throws IOException {
        engine.ingest(new ListRecordSource(records()), SCHEMA, layout);

        Map<String, ColumnKind> expected = Map.of("A", ColumnKind.NUMERIC, "B", ColumnKind.NUMERIC,
                "color", ColumnKind.CATEGORICAL, "target", ColumnKind.NUMERIC);
        assertEquals(expected, FeatureTableCsv.readKinds(layout.ingestedTrainFile()));
        assertEquals(expected, FeatureTableCsv.readKinds(layout.ingestedTestFile()));
        assertEquals(expected, FeatureTableCsv.readKinds(layout.featureStoreFile()));
    }

    // =========================================================================
    // Failures
    // =========================================================================

    @Test
    @DisplayName("Should fail on an empty source")
    void testIngest_EmptySource() {
        IngestionException ex = assertThrows(IngestionException.class,
                () -> engine.ingest(new ListRecordSource(List.of()), SCHEMA, layout));

        assertEquals(0L, ex.getRowsRead());
        assertEquals("ingestion", ex.getStage());
        assertEquals(1.0, failures());
    }

    @Test
    @DisplayName("Should report rows read before a source failure and still close the cursor")
    void testIngest_ReadFailure() {
        ListRecordSource source = new ListRecordSource(records(), 2);

        IngestionException ex = assertThrows(IngestionException.class, () -> engine.ingest(source, SCHEMA, layout));

        assertEquals(14L, ex.getRowsRead());
        assertTrue(ex.getMessage().contains("connection reset"));
        assertEquals(1, source.cursorsClosed());
        assertFalse(Files.exists(layout.featureStoreFile()));
    }

    @Test
    @DisplayName("Should fail when the target column is absent")
    void testIngest_TargetAbsent() {
        List<SourceRecord> records = List.of(record("A", 1), record("A", 2));

        IngestionException ex = assertThrows(IngestionException.class,
                () -> engine.ingest(new ListRecordSource(records), SCHEMA, layout));
        assertTrue(ex.getMessage().contains("'target'"));
    }

    @Test
    @DisplayName("Should fail when a target value is missing")
    void testIngest_TargetValueMissing() {
        List<SourceRecord> records = new ArrayList<>(records());
        records.set(3, record("A", 1.0, "B", 3, "color", "red", "target", "NA"));

        IngestionException ex = assertThrows(IngestionException.class,
                () -> engine.ingest(new ListRecordSource(records), SCHEMA, layout));
        assertTrue(ex.getMessage().contains("1 missing value"));
        assertEquals(50L, ex.getRowsRead());
    }

    @Test
    @DisplayName("Should fail when a class is too small to stratify")
    void testIngest_Unstratifiable() {
        List<SourceRecord> records = new ArrayList<>(records());
        records.add(record("A", 1.0, "B", 99, "color", "red", "target", 7));

        IngestionException ex = assertThrows(IngestionException.class,
                () -> engine.ingest(new ListRecordSource(records), SCHEMA, layout));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    @DisplayName("Should never overwrite the artifacts of an existing run")
    void testIngest_ExistingRun() throws IOException {
        engine.ingest(new ListRecordSource(records()), SCHEMA, layout);
        byte[] before = Files.readAllBytes(layout.ingestedTrainFile());

        assertThrows(IngestionException.class, () -> engine.ingest(new ListRecordSource(records()), SCHEMA, layout));
        assertArrayEquals(before, Files.readAllBytes(layout.ingestedTrainFile()));
    }
}
