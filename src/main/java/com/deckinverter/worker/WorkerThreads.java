package com.deckinverter.worker;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class WorkerThreads {

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private WorkerThreads() { }

    /** Fixed pool of daemon threads named {@code <prefix>-<pool>-<n>}. */
    static ExecutorService fixedPool(String prefix, int size) {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(size, factory);
    }
}
