package com.p14n.subsync.sequencer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.subsync.telemetry.SequencerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.subsync.telemetry.OpenTelemetryFunctions.runWithTelemetry;

/**
 * Ordered work queue with exactly one worker thread.
 *
 * <p>
 * Any number of threads may {@link #submit} work; submission never blocks.
 * Items run one at a time in submission order. An item that throws is logged
 * and the worker moves on to the next one.
 * </p>
 *
 * <p>
 * {@link #shutdown(Duration)} lets queued items finish for at most the given
 * timeout. After that the running item is interrupted and no further item
 * starts. The interrupted item and everything not yet run are abandoned,
 * logged item by item, and reported through a {@link SequencerTimeoutException}.
 * </p>
 */
public class Sequencer {

    private static final Logger logger = LoggerFactory.getLogger(Sequencer.class);
    private static final AttributeKey<String> ITEM = AttributeKey.stringKey("work_item");
    private static final Duration ABANDON_GRACE = Duration.ofMillis(100);

    private final String name;
    private final ThreadPoolExecutor worker;
    private final Tracer tracer;
    private final SequencerMetrics metrics;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final List<String> skipped = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    // guarded by lock
    private WorkItem running;
    private boolean abandoning;

    /**
     * Creates a sequencer with its own named daemon worker thread.
     *
     * @param name identifies the sequencer in thread names, logs and metrics
     * @param ot   OpenTelemetry instance for tracing and metrics
     */
    public Sequencer(String name, OpenTelemetry ot) {
        this.name = name;
        this.tracer = ot.getTracer("subsync.sequencer");
        this.metrics = new SequencerMetrics(ot.getMeter("subsync.sequencer"), name);
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("subsync-" + name + "-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Queues a unit of work behind everything already submitted.
     *
     * @param description names the item in logs and shutdown reports
     * @param work        the work to run on the sequencer thread
     * @return true if the item was queued, false if the sequencer is shut down
     */
    public boolean submit(String description, Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("Work cannot be null");
        }
        WorkItem item = new WorkItem(description, Context.current().wrap(work));
        metrics.recordSubmitted();
        try {
            worker.execute(item);
            return true;
        } catch (RejectedExecutionException e) {
            metrics.recordAbandoned(1);
            logger.atWarn()
                    .addArgument(description)
                    .addArgument(name)
                    .log("Rejected work item {}, sequencer {} is shut down");
            return false;
        }
    }

    /**
     * Gets the number of items queued and not yet started.
     *
     * @return the queue depth
     */
    public int pending() {
        return worker.getQueue().size();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stops accepting work and waits for the queue to drain.
     *
     * @param timeout how long to wait for queued items
     * @throws SequencerTimeoutException if items were still outstanding when the
     *                                   timeout elapsed
     */
    public void shutdown(Duration timeout) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo()
                .addArgument(name)
                .addArgument(worker.getQueue().size())
                .log("Shutting down sequencer {} with {} queued item(s)");

        worker.shutdown();
        boolean finished;
        try {
            finished = worker.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = false;
        }
        if (finished) {
            logger.atInfo().addArgument(name).log("Sequencer {} shut down");
            return;
        }

        WorkItem interrupted;
        synchronized (lock) {
            abandoning = true;
            interrupted = running;
        }
        if (interrupted != null) {
            logger.atWarn()
                    .addArgument(interrupted.description)
                    .addArgument(name)
                    .log("Interrupting work item {} still running on sequencer {}");
        }
        List<Runnable> queued = worker.shutdownNow();
        try {
            // an item taken off the queue before shutdownNow skips itself
            worker.awaitTermination(ABANDON_GRACE.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<String> abandoned = new ArrayList<>();
        if (interrupted != null) {
            abandoned.add(interrupted.description);
        }
        for (String description : skipped) {
            abandoned.add(description);
            logger.atWarn()
                    .addArgument(description)
                    .addArgument(name)
                    .log("Abandoned work item {} taken by sequencer {}");
        }
        for (Runnable r : queued) {
            String description = r instanceof WorkItem ? ((WorkItem) r).description : r.toString();
            abandoned.add(description);
            logger.atWarn()
                    .addArgument(description)
                    .addArgument(name)
                    .log("Abandoned work item {} queued on sequencer {}");
        }
        metrics.recordAbandoned(interrupted == null ? abandoned.size() : abandoned.size() - 1);
        throw new SequencerTimeoutException(name, timeout, abandoned);
    }

    private class WorkItem implements Runnable {
        private final String description;
        private final Runnable work;

        WorkItem(String description, Runnable work) {
            this.description = description == null ? "work item" : description;
            this.work = work;
        }

        @Override
        public void run() {
            synchronized (lock) {
                if (abandoning) {
                    skipped.add(description);
                    return;
                }
                running = this;
            }
            try {
                runWithTelemetry(tracer, "sequencer_item", Attributes.of(ITEM, description), work);
                metrics.recordCompleted();
            } catch (Exception e) {
                metrics.recordFailed();
                logger.atError()
                        .addArgument(description)
                        .addArgument(name)
                        .setCause(e)
                        .log("Work item {} failed on sequencer {}");
            } catch (Error e) {
                metrics.recordFailed();
                logger.atError()
                        .addArgument(description)
                        .addArgument(name)
                        .setCause(e)
                        .log("Work item {} failed with an error on sequencer {}");
                throw e;
            } finally {
                synchronized (lock) {
                    running = null;
                }
            }
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
