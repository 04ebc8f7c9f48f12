package com.example.musiccurator.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService curatorWorkerExecutor;

    /**
     * Shared pool for metadata extraction, hashing and read-only matching. Catalog writes never
     * happen on these threads.
     */
    @Bean
    public ExecutorService curatorWorkerExecutor(AppLibraryProperties appLibraryProperties) {
        int workers = appLibraryProperties.effectiveWorkerThreads();
        this.curatorWorkerExecutor = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(64, workers * 16)),
                new NamedThreadFactory("curator-worker-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        return this.curatorWorkerExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (curatorWorkerExecutor != null) {
            curatorWorkerExecutor.shutdownNow();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
