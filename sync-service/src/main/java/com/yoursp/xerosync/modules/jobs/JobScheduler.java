package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.ScheduleProperties;
import com.yoursp.xerosync.modules.jobs.exception.TriggerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live cron triggers for registry jobs, keyed by job id.
 * <p>
 * A firing never runs the job body: it looks up the stored invocation and
 * pushes it onto the {@link JobQueue}. Spring's {@link CronTrigger} computes
 * the next firing only after the previous callback returned, so firings of
 * one job id never overlap and missed firings collapse into one.
 * </p>
 * Triggers live in memory only; after a restart they are re-registered by
 * {@link JobManager#startJobsOnStartup()}.
 */
@Slf4j
@Component
public class JobScheduler {

    private final TaskScheduler taskScheduler;
    private final JobQueue jobQueue;
    private final ScheduleProperties scheduleProperties;

    private final Map<String, TriggerRegistration> registrations = new ConcurrentHashMap<>();
    private final ReentrantLock registrationLock = new ReentrantLock();

    public JobScheduler(@Qualifier("cronTaskScheduler") TaskScheduler taskScheduler,
            JobQueue jobQueue,
            ScheduleProperties scheduleProperties) {
        this.taskScheduler = taskScheduler;
        this.jobQueue = jobQueue;
        this.scheduleProperties = scheduleProperties;
    }

    /**
     * Register (or replace) the trigger for a job id.
     *
     * @param name human readable trigger name for logs
     * @return next fire time
     */
    public OffsetDateTime register(String jobId, String name, JobInvocation invocation) {
        String expression = scheduleProperties.toCronExpression();
        CronTrigger trigger = new CronTrigger(expression, scheduleProperties.getZone());

        TriggerRegistration registration = new TriggerRegistration(name, invocation);
        // put, schedule and setFuture must not interleave with another register or remove
        registrationLock.lock();
        try {
            TriggerRegistration previous = registrations.put(jobId, registration);
            if (previous != null) {
                previous.cancel();
                log.debug("Replaced existing trigger for job {}", jobId);
            }

            ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(jobId), trigger);
            registration.setFuture(future);
        } finally {
            registrationLock.unlock();
        }

        OffsetDateTime nextRun = nextFireTime();
        log.info("Registered trigger '{}' for job {} (cron '{}', next run {})", name, jobId, expression, nextRun);
        return nextRun;
    }

    /**
     * Cancel and forget the trigger for a job id.
     *
     * @throws TriggerNotFoundException when no trigger is registered
     */
    public void remove(String jobId) {
        TriggerRegistration registration;
        registrationLock.lock();
        try {
            registration = registrations.remove(jobId);
            if (registration == null) {
                throw new TriggerNotFoundException(jobId);
            }
            registration.cancel();
        } finally {
            registrationLock.unlock();
        }
        log.info("Removed trigger '{}' for job {}", registration.getName(), jobId);
    }

    public boolean isRegistered(String jobId) {
        return registrations.containsKey(jobId);
    }

    public int registeredCount() {
        return registrations.size();
    }

    public Set<String> registeredJobIds() {
        return Set.copyOf(registrations.keySet());
    }

    public Optional<OffsetDateTime> nextFireTime(String jobId) {
        return isRegistered(jobId) ? Optional.of(nextFireTime()) : Optional.empty();
    }

    /** Number of times the job's trigger has fired since it was registered. */
    public long fireCount(String jobId) {
        TriggerRegistration registration = registrations.get(jobId);
        return registration != null ? registration.getFireCount() : 0;
    }

    /**
     * Trigger callback: hand the stored invocation to the queue.
     */
    void fire(String jobId) {
        TriggerRegistration registration = registrations.get(jobId);
        if (registration == null) {
            log.error("Job parameters not found for job {}", jobId);
            return;
        }
        registration.markFired();
        log.info("Trigger '{}' fired, queueing job {}", registration.getName(), jobId);
        jobQueue.enqueue(registration.getInvocation());
    }

    private OffsetDateTime nextFireTime() {
        CronExpression cron = CronExpression.parse(scheduleProperties.toCronExpression());
        ZonedDateTime next = cron.next(ZonedDateTime.now(scheduleProperties.getZone()));
        return next != null ? next.toOffsetDateTime() : null;
    }

    static final class TriggerRegistration {

        private final String name;
        private final JobInvocation invocation;
        private final AtomicLong fireCount = new AtomicLong();
        private volatile ScheduledFuture<?> future;

        TriggerRegistration(String name, JobInvocation invocation) {
            this.name = name;
            this.invocation = invocation;
        }

        String getName() {
            return name;
        }

        JobInvocation getInvocation() {
            return invocation;
        }

        long getFireCount() {
            return fireCount.get();
        }

        void markFired() {
            fireCount.incrementAndGet();
        }

        void setFuture(ScheduledFuture<?> future) {
            this.future = future;
        }

        void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
