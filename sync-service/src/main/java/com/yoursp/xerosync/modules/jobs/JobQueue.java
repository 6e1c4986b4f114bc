package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.JobQueueProperties;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process FIFO that runs job bodies one at a time.
 * <ul>
 * <li>A single worker drains the queue; enqueue starts it when none is running</li>
 * <li>Each body runs to completion before the next one starts; a body past its
 * deadline is cancelled and the queue waits for it to exit</li>
 * <li>A failing or timed-out body is logged and the queue moves on</li>
 * <li>Contents are not persisted; lost work is regenerated by the next trigger firing</li>
 * </ul>
 */
@Slf4j
@Component
public class JobQueue {

    static final String MDC_JOB_LABEL = "jobLabel";

    private final Executor workerExecutor;
    private final AsyncTaskExecutor bodyExecutor;
    private final JobQueueProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueuedTask> pending = new ArrayDeque<>();
    private boolean workerRunning;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public JobQueue(@Qualifier("jobQueueExecutor") Executor workerExecutor,
            @Qualifier("jobBodyExecutor") AsyncTaskExecutor bodyExecutor,
            JobQueueProperties properties) {
        this.workerExecutor = workerExecutor;
        this.bodyExecutor = bodyExecutor;
        this.properties = properties;
    }

    public void enqueue(JobInvocation invocation) {
        enqueue(invocation.label(), invocation);
    }

    /**
     * Add a task to the tail of the queue and make sure a worker is draining it.
     */
    public void enqueue(String label, Runnable task) {
        lock.lock();
        try {
            pending.addLast(new QueuedTask(label, task));
            log.debug("Queued {} ({} pending)", label, pending.size());
            if (!workerRunning) {
                workerRunning = true;
                try {
                    workerExecutor.execute(this::drain);
                } catch (RuntimeException e) {
                    workerRunning = false;
                    throw e;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isWorkerRunning() {
        lock.lock();
        try {
            return workerRunning;
        } finally {
            lock.unlock();
        }
    }

    public long completedCount() {
        return completed.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void drain() {
        while (true) {
            QueuedTask next;
            lock.lock();
            try {
                next = pending.pollFirst();
                if (next == null) {
                    // Checked under the lock so an enqueue cannot slip in unseen
                    workerRunning = false;
                    return;
                }
            } finally {
                lock.unlock();
            }

            boolean interrupted = runWithDeadline(next);
            if (interrupted || !pause()) {
                stopWorker();
                return;
            }
        }
    }

    /**
     * @return true when the worker itself was interrupted and must stop
     */
    private boolean runWithDeadline(QueuedTask task) {
        Duration timeout = properties.getJobTimeout();
        MDC.put(MDC_JOB_LABEL, task.label());
        log.info("Executing queued job {}", task.label());
        CountDownLatch exited = new CountDownLatch(1);
        Future<?> future = null;
        try {
            future = bodyExecutor.submit(() -> {
                try {
                    task.body().run();
                } finally {
                    exited.countDown();
                }
            });
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            completed.incrementAndGet();
            log.info("Queued job {} finished", task.label());
        } catch (TimeoutException e) {
            future.cancel(true);
            failed.incrementAndGet();
            log.error("Queued job {} timed out after {} ms and was cancelled", task.label(), timeout.toMillis());
            return !awaitExit(task, exited);
        } catch (ExecutionException e) {
            failed.incrementAndGet();
            log.error("Error executing queued job {}: {}", task.label(), e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            log.warn("Job queue worker interrupted while running {}", task.label());
            return true;
        } catch (RuntimeException e) {
            // Body executor rejected the task
            failed.incrementAndGet();
            log.error("Could not start queued job {}: {}", task.label(), e.getMessage(), e);
        } finally {
            MDC.remove(MDC_JOB_LABEL);
        }
        return false;
    }

    /**
     * Block until a cancelled body has really returned, so the next job never
     * overlaps a body that ignores interruption.
     *
     * @return false when the worker was interrupted while waiting
     */
    private boolean awaitExit(QueuedTask task, CountDownLatch exited) {
        Duration grace = properties.getCancelGracePeriod();
        try {
            while (!exited.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Cancelled job {} still running after a further {} ms, holding the queue",
                        task.label(), grace.toMillis());
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job queue worker interrupted while waiting for cancelled job {} to exit", task.label());
            return false;
        }
    }

    private boolean pause() {
        Duration delay = properties.getDelayBetweenJobs();
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job queue worker interrupted, {} job(s) left pending", pendingCount());
            return false;
        }
    }

    private void stopWorker() {
        lock.lock();
        try {
            workerRunning = false;
        } finally {
            lock.unlock();
        }
    }

    record QueuedTask(String label, Runnable body) {
    }
}
