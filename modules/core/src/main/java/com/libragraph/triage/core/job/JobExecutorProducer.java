package com.libragraph.triage.core.job;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class JobExecutorProducer {

    @ConfigProperty(name = "triage.jobs.worker-count", defaultValue = "2")
    int workerCount;

    private volatile ExecutorService extractionExecutor;
    private volatile ExecutorService extractorExecutor;

    /** Runs whole jobs; bounds how many cases are extracted at once. */
    @Produces
    @ApplicationScoped
    @Named("extractionExecutor")
    public ExecutorService extractionExecutor() {
        extractionExecutor = Executors.newFixedThreadPool(workerCount, named("extraction-worker-"));
        return extractionExecutor;
    }

    /** Runs the extractors of one job side by side. */
    @Produces
    @ApplicationScoped
    @Named("extractorExecutor")
    public ExecutorService extractorExecutor() {
        extractorExecutor = Executors.newCachedThreadPool(named("extractor-"));
        return extractorExecutor;
    }

    /** Load of the job and extractor pools, for diagnostics. */
    public List<WorkerPool> pools() {
        return List.of(WorkerPool.of("extraction", extractionExecutor), WorkerPool.of("extractor", extractorExecutor));
    }

    public int workerCount() {
        return workerCount;
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    void shutdown() {
        if (extractionExecutor != null) extractionExecutor.shutdownNow();
        if (extractorExecutor != null) extractorExecutor.shutdownNow();
    }
}
