package com.deckinverter.worker;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Bounded pool running one document per slot. At most {@link #getMaxWorkers()}
 * documents are in flight at any time; further submissions queue.
 */
public interface WorkerPool extends AutoCloseable {

    /**
     * Queue a document. The future completes with the document's result;
     * it completes exceptionally only when the backend itself breaks down.
     */
    CompletableFuture<ProcessingResult> submit(DocumentSource document, SerializedConfig config);

    int getMaxWorkers();

    /**
     * Stop accepting work. Documents already running finish; queued documents
     * still run unless their futures were cancelled first.
     */
    @Override
    void close();
}
