package com.di.featurenova.pipeline.source;

import java.util.List;

/**
 * Forward-only batched reader over a {@link RecordSource}.
 */
public interface RecordCursor extends AutoCloseable {

    /**
     * Next batch of at most the cursor's batch size; an empty list once the
     * source is exhausted. Each call is bounded by the cursor's batch timeout.
     *
     * @throws RecordSourceException when the read fails or times out
     */
    List<SourceRecord> nextBatch();

    @Override
    void close();
}
