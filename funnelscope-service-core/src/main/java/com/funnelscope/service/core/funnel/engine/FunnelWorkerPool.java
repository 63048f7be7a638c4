package com.funnelscope.service.core.funnel.engine;

import com.funnelscope.service.core.config.FunnelProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Fixed pool that runs actor batches of every funnel query. Batches hold no shared mutable state. */
@Component
@Slf4j
@RequiredArgsConstructor
public class FunnelWorkerPool {

    private final FunnelProperties properties;

    private ExecutorService executor;
    private int workers;

    @PostConstruct
    public void start() {
        init(properties.getEngine().effectiveWorkers());
    }

    void init(int workerCount) {
        if (executor != null) {
            return;
        }
        this.workers = workerCount;
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "funnel-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        executor = Executors.newFixedThreadPool(workerCount, factory);
        log.info("Funnel worker pool started workers={}", workerCount);
    }

    @PreDestroy
    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    public <T> List<Future<T>> submitAll(List<? extends Callable<T>> tasks) {
        if (executor == null) {
            throw new IllegalStateException("Funnel worker pool is not started");
        }
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(executor.submit(task));
        }
        return futures;
    }

    public int workers() {
        return workers;
    }
}
