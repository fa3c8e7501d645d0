package com.deckinverter.model;

/**
 * Execution backend for the bounded worker pool.
 */
public enum WorkerBackend {
    /** One JVM per document; isolates crashes and memory spikes. */
    PROCESS,
    /** Pooled threads in the calling JVM. */
    THREAD;

    public static WorkerBackend parse(String value) {
        if (value == null || value.isBlank()) {
            return PROCESS;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Unknown worker backend '" + value + "' (expected process or thread)", e);
        }
    }
}
