package com.di.featurenova.pipeline.source;

import java.time.Duration;

/**
 * A document or record store the ingestion stage reads from.
 *
 * <p>Implementations own the resources they open (connection pools, file
 * handles) and release them on {@link #close()}.
 */
public interface RecordSource extends AutoCloseable {

    /** Short human-readable description for logs; never contains credentials. */
    String describe();

    RecordCursor openCursor(int batchSize, Duration batchTimeout);

    @Override
    void close();
}
