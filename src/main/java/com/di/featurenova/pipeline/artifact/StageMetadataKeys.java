package com.di.featurenova.pipeline.artifact;

/**
 * Keys of the {@link StageMetadata} entries exchanged between stages.
 */
public final class StageMetadataKeys {

    private StageMetadataKeys() {
    }

    public static final String STAGE_INGESTION      = "ingestion";
    public static final String STAGE_VALIDATION     = "validation";
    public static final String STAGE_TRANSFORMATION = "transformation";

    // ingestion
    public static final String FEATURE_STORE_PATH = "feature_store_path";
    public static final String TRAIN_PATH         = "train_path";
    public static final String TEST_PATH          = "test_path";

    // validation
    public static final String VALIDATED_TRAIN_PATH = "validated_train_path";
    public static final String VALIDATED_TEST_PATH  = "validated_test_path";
    public static final String DRIFT_REPORT_PATH    = "drift_report_path";
    public static final String VALIDATION_STATUS    = "validation_status";
    public static final String DRIFT_DETECTED       = "drift_detected";

    // transformation
    public static final String TRANSFORMED_TRAIN_PATH = "transformed_train_path";
    public static final String TRANSFORMED_TEST_PATH  = "transformed_test_path";
    public static final String PREPROCESSOR_PATH      = "preprocessor_path";

    // attributes
    public static final String ROW_COUNT      = "row_count";
    public static final String TRAIN_ROWS     = "train_rows";
    public static final String TEST_ROWS      = "test_rows";
    public static final String FEATURE_WIDTH  = "feature_width";
}
