package com.raditha.repairgraph.analyzer;

import com.raditha.repairgraph.config.AnalysisConfig;
import com.raditha.repairgraph.metrics.GraphMetricsCalculator;
import com.raditha.repairgraph.metrics.GraphMetricsReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Measures many bug instances in parallel.
 * <p>
 * Each worker hands its instance to a runner thread and waits at most the configured instance
 * timeout, counted from the moment the runner starts. A failing or overdue instance yields a
 * failure report and never stops the batch. An overdue instance is cancelled by interrupting its
 * runner; a runner that ignores the interrupt keeps its thread, so runners come from a pool that
 * starts a new thread rather than queue behind it. The worker count bounds the parallelism.
 */
public class BatchAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final AnalysisConfig config;
    private final GraphMetricsCalculator calculator;

    public BatchAnalyzer(AnalysisConfig config) {
        this(config, new GraphMetricsCalculator(config));
    }

    public BatchAnalyzer(AnalysisConfig config, GraphMetricsCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
    }

    /**
     * Analyze all instances. Reports come back in the order of the input.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public List<InstanceReport> analyze(List<BugInstance> instances) throws InterruptedException {
        if (instances.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(config.threads(), instances.size());
        ExecutorService workers = Executors.newFixedThreadPool(threads, named("repairgraph-worker"));
        ExecutorService runners = Executors.newCachedThreadPool(named("repairgraph-runner"));
        AtomicInteger done = new AtomicInteger();
        try {
            List<Future<InstanceReport>> futures = new ArrayList<>();
            for (BugInstance instance : instances) {
                futures.add(workers.submit(() -> {
                    InstanceReport report = runOne(instance, runners);
                    logger.info("[{}/{}] {} {} ({} ms)", done.incrementAndGet(), instances.size(),
                            instance.id(), report.status(), report.elapsedMillis());
                    return report;
                }));
            }
            List<InstanceReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    reports.add(InstanceReport.failed(instances.get(i).id(), describe(e.getCause()), 0));
                }
            }
            return reports;
        } finally {
            workers.shutdownNow();
            runners.shutdownNow();
        }
    }

    /**
     * Run one instance with its own timeout, which starts once a runner picks the instance up.
     * Never throws except on interruption of the worker.
     */
    InstanceReport runOne(BugInstance instance, ExecutorService runners) throws InterruptedException {
        CountDownLatch running = new CountDownLatch(1);
        Future<GraphMetricsReport> future = runners.submit(() -> {
            running.countDown();
            return calculator.compute(instance.id(), instance.files());
        });
        long started;
        try {
            running.await();
            started = System.nanoTime();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        try {
            GraphMetricsReport report = future.get(config.instanceTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return InstanceReport.succeeded(instance.id(), report, elapsedSince(started));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Instance {} timed out after {}", instance.id(), config.instanceTimeout());
            return InstanceReport.timedOut(instance.id(), elapsedSince(started));
        } catch (ExecutionException e) {
            logger.warn("Instance {} failed: {}", instance.id(), describe(e.getCause()));
            return InstanceReport.failed(instance.id(), describe(e.getCause()), elapsedSince(started));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static long elapsedSince(long started) {
        return (System.nanoTime() - started) / 1_000_000;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
