package com.deckinverter.worker;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs documents on pooled threads inside this JVM. Uses less memory than
 * the process backend, at the price of no crash isolation.
 */
@Slf4j
public class ThreadWorkerPool implements WorkerPool {

    private final int maxWorkers;
    private final DocumentWorker worker;
    private final ExecutorService executor;

    public ThreadWorkerPool(int maxWorkers, DocumentWorker worker) {
        this.maxWorkers = maxWorkers;
        this.worker = worker;
        this.executor = WorkerThreads.fixedPool("deck-worker", maxWorkers);
    }

    @Override
    public CompletableFuture<ProcessingResult> submit(DocumentSource document, SerializedConfig config) {
        return CompletableFuture.supplyAsync(() -> worker.process(document, config), executor);
    }

    @Override
    public int getMaxWorkers() {
        return maxWorkers;
    }

    @Override
    public void close() {
        executor.shutdown();
        log.debug("Thread worker pool closed");
    }
}
