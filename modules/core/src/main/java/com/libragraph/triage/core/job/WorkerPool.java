package com.libragraph.triage.core.job;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Point-in-time load of one executor.
 *
 * @param started false until the pool is first used
 */
public record WorkerPool(String name, boolean started, int threads, int active, int queued) {

    static WorkerPool of(String name, ExecutorService executor) {
        if (executor instanceof ThreadPoolExecutor pool) {
            return new WorkerPool(name, true, pool.getPoolSize(), pool.getActiveCount(), pool.getQueue().size());
        }
        return new WorkerPool(name, executor != null, 0, 0, 0);
    }
}
