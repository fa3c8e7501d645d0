package com.deckinverter.worker;

import com.deckinverter.model.ConcurrencyOptions;

/**
 * Picks the pool implementation for the requested backend.
 */
public class WorkerPoolFactory {

    private final DocumentWorker worker;
    private final WorkerLaunchSettings launchSettings;

    public WorkerPoolFactory(DocumentWorker worker, WorkerLaunchSettings launchSettings) {
        this.worker = worker;
        this.launchSettings = launchSettings;
    }

    public WorkerPool create(ConcurrencyOptions options) {
        options.validate();
        return switch (options.getWorkerBackend()) {
            case PROCESS -> new ProcessWorkerPool(options.getMaxWorkers(), launchSettings);
            case THREAD -> new ThreadWorkerPool(options.getMaxWorkers(), worker);
        };
    }
}
