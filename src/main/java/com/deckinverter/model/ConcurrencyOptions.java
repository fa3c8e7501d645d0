package com.deckinverter.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConcurrencyOptions {

    public static final int DEFAULT_MAX_WORKERS = 2;

    @Builder.Default
    WorkerBackend workerBackend = WorkerBackend.PROCESS;

    /** Hard cap on documents processed at the same time. */
    @Builder.Default
    int maxWorkers = DEFAULT_MAX_WORKERS;

    public static ConcurrencyOptions defaults() {
        return builder().build();
    }

    public static ConcurrencyOptions threads(int maxWorkers) {
        return builder().workerBackend(WorkerBackend.THREAD).maxWorkers(maxWorkers).build();
    }

    public void validate() {
        if (workerBackend == null) {
            throw new InvalidConfigException("Worker backend must be set");
        }
        if (maxWorkers < 1) {
            throw new InvalidConfigException("max_workers must be a positive integer (got " + maxWorkers + ")");
        }
    }
}
