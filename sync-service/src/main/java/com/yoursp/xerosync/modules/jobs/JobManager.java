package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.ScheduleProperties;
import com.yoursp.xerosync.model.entity.JobType;
import com.yoursp.xerosync.model.entity.ScheduledJob;
import com.yoursp.xerosync.model.entity.TenantMetadata;
import com.yoursp.xerosync.model.entity.User;
import com.yoursp.xerosync.modules.jobs.dto.JobStartResult;
import com.yoursp.xerosync.modules.jobs.dto.JobStopResult;
import com.yoursp.xerosync.modules.jobs.dto.ReconciliationSummary;
import com.yoursp.xerosync.modules.jobs.exception.JobConfigurationException;
import com.yoursp.xerosync.modules.jobs.exception.JobNotFoundException;
import com.yoursp.xerosync.modules.jobs.exception.JobOperationException;
import com.yoursp.xerosync.modules.jobs.exception.TenantNotFoundException;
import com.yoursp.xerosync.modules.jobs.exception.TriggerNotFoundException;
import com.yoursp.xerosync.modules.jobs.exception.UserNotFoundException;
import com.yoursp.xerosync.modules.processing.TenantJobProcessor;
import com.yoursp.xerosync.modules.token.XeroTokenManager;
import com.yoursp.xerosync.modules.token.exception.MissingCredentialException;
import com.yoursp.xerosync.repository.ScheduledJobRepository;
import com.yoursp.xerosync.repository.TenantMetadataRepository;
import com.yoursp.xerosync.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for starting, stopping and restoring tenant jobs.
 * <p>
 * The scheduled_jobs table is the durable intent; live triggers in
 * {@link JobScheduler} are a disposable projection of its active rows.
 * At most one active row exists per (user, tenant, job type): starting an
 * already scheduled job returns the existing id.
 * </p>
 */
@Slf4j
@Service
public class JobManager {

    private final ScheduledJobRepository jobRepository;
    private final UserRepository userRepository;
    private final TenantMetadataRepository tenantMetadataRepository;
    private final JobScheduler jobScheduler;
    private final JobQueue jobQueue;
    private final XeroTokenManager tokenManager;
    private final ScheduleProperties scheduleProperties;
    private final Map<JobType, TenantJobProcessor> processors = new EnumMap<>(JobType.class);

    // Guards lookup-then-insert on the registry
    private final ReentrantLock registryLock = new ReentrantLock();

    public JobManager(ScheduledJobRepository jobRepository,
            UserRepository userRepository,
            TenantMetadataRepository tenantMetadataRepository,
            JobScheduler jobScheduler,
            JobQueue jobQueue,
            XeroTokenManager tokenManager,
            ScheduleProperties scheduleProperties,
            List<TenantJobProcessor> processors) {
        this.jobRepository = jobRepository;
        this.userRepository = userRepository;
        this.tenantMetadataRepository = tenantMetadataRepository;
        this.jobScheduler = jobScheduler;
        this.jobQueue = jobQueue;
        this.tokenManager = tokenManager;
        this.scheduleProperties = scheduleProperties;
        processors.forEach(p -> this.processors.put(p.jobType(), p));
        for (JobType type : JobType.values()) {
            if (!this.processors.containsKey(type)) {
                throw new IllegalStateException("No processor registered for job type " + type.getValue());
            }
        }
    }

    // ================================================================
    // Start
    // ================================================================

    /**
     * Ensure a scheduled job exists for (user, tenant, job type). A new job is
     * registered with the scheduler and one run is queued immediately.
     *
     * @throws UserNotFoundException      user does not exist
     * @throws JobConfigurationException  user has no brain id
     * @throws TenantNotFoundException    user never connected the tenant
     * @throws JobOperationException      unexpected failure
     */
    public JobStartResult startJobForUser(UUID userId, String tenantId, JobType jobType) {
        try {
            User user = userRepository.findById(userId)
                    .orElseThrow(() -> new UserNotFoundException(userId));
            if (!user.hasBrain()) {
                throw new JobConfigurationException("User " + userId + " has no brain_id configured");
            }
            tenantMetadataRepository.findByTenantIdAndUserId(tenantId, userId)
                    .orElseThrow(() -> new TenantNotFoundException(tenantId, userId));

            String description = describeSchedule();

            registryLock.lock();
            try {
                Optional<ScheduledJob> existing = jobRepository
                        .findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(userId, tenantId, jobType);
                if (existing.isPresent()) {
                    String jobId = existing.get().getId();
                    log.info("Job {} already exists and running for user {} and type {}",
                            jobId, userId, jobType.getValue());
                    return JobStartResult.builder()
                            .status("success")
                            .message(jobType.displayName() + " processing is already scheduled")
                            .jobId(jobId)
                            .alreadyScheduled(true)
                            .scheduleDescription(description)
                            .processedAt(OffsetDateTime.now())
                            .nextRun(jobScheduler.nextFireTime(jobId).orElse(null))
                            .build();
                }

                ScheduledJob job = createJob(userId, tenantId, user.getBrainId(), jobType);
                log.info("Created new {} job {} for user {}", jobType.getValue(), job.getId(), userId);

                OffsetDateTime nextRun = installAndQueue(job);
                log.info("Scheduled {} job {} to run {}, next run {}",
                        jobType.getValue(), job.getId(), description, nextRun);

                return JobStartResult.builder()
                        .status("success")
                        .message(jobType.displayName() + " processing started and will run " + description)
                        .jobId(job.getId())
                        .alreadyScheduled(false)
                        .scheduleDescription(description)
                        .processedAt(OffsetDateTime.now())
                        .nextRun(nextRun)
                        .build();
            } finally {
                registryLock.unlock();
            }

        } catch (UserNotFoundException | JobConfigurationException | TenantNotFoundException e) {
            log.warn("Cannot start {} job for user {}, tenant {}: {}",
                    jobType.getValue(), userId, tenantId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Error starting {} job: {}", jobType.getValue(), e.getMessage(), e);
            throw new JobOperationException(
                    "Failed to start " + jobType.getValue() + " processing: " + e.getMessage(), e);
        }
    }

    /**
     * Start every job type for a tenant.
     */
    public Map<JobType, JobStartResult> startAllJobsForTenant(UUID userId, String tenantId) {
        Map<JobType, JobStartResult> results = new EnumMap<>(JobType.class);
        for (JobType jobType : JobType.values()) {
            results.put(jobType, startJobForUser(userId, tenantId, jobType));
        }
        return results;
    }

    /**
     * Select a tenant for the user's session and make sure its jobs are running.
     *
     * @throws TenantNotFoundException    user never connected the tenant
     * @throws MissingCredentialException user has no stored Xero token
     */
    public Map<JobType, JobStartResult> activateTenant(UUID userId, String tenantId) {
        TenantMetadata tenant = tenantMetadataRepository.findByTenantIdAndUserId(tenantId, userId)
                .orElseThrow(() -> new TenantNotFoundException(tenantId, userId));

        if (!tokenManager.setActiveTenant(userId, tenantId)) {
            throw new MissingCredentialException(userId);
        }
        log.info("Activated tenant {} ({}) for user {}", tenantId, tenant.getTenantName(), userId);

        return startAllJobsForTenant(userId, tenantId);
    }

    public List<ScheduledJob> findActiveJobs(UUID userId, String tenantId) {
        return jobRepository.findByUserIdAndTenantIdAndIsActiveTrue(userId, tenantId);
    }

    public String describeSchedule() {
        return ScheduleDescriber.describe(scheduleProperties);
    }

    // ================================================================
    // Stop
    // ================================================================

    /**
     * Deactivate a job and remove its live trigger. The registry row is
     * updated first; a missing trigger is not an error.
     *
     * @throws JobNotFoundException  no such job
     * @throws JobOperationException the registry could not be updated
     */
    public JobStopResult stopJob(String jobId) {
        ScheduledJob job;
        try {
            job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            job.setIsActive(false);
            jobRepository.save(job);
        } catch (JobNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error stopping job {}: {}", jobId, e.getMessage(), e);
            throw new JobOperationException("Failed to stop job: " + e.getMessage(), e);
        }

        boolean triggerRemoved = false;
        try {
            jobScheduler.remove(jobId);
            triggerRemoved = true;
        } catch (TriggerNotFoundException e) {
            log.warn("Job {} not found in scheduler, but marked as inactive in database", jobId);
        } catch (RuntimeException e) {
            log.error("Job {} marked inactive but its trigger could not be removed: {}", jobId, e.getMessage(), e);
        }

        log.info("Stopped {} job {}", job.getJobType().getValue(), jobId);
        return new JobStopResult(jobId,
                job.getJobType().displayName() + " processing stopped successfully",
                triggerRemoved);
    }

    // ================================================================
    // Startup reconciliation
    // ================================================================

    /**
     * Create any missing registry rows for every connected tenant, then
     * (re)install a trigger and queue one run for every active row.
     * Safe to run repeatedly: existing rows are reused and triggers replaced.
     */
    public ReconciliationSummary startJobsOnStartup() {
        List<TenantMetadata> tenants = tenantMetadataRepository.findAll();
        log.info("Found {} tenant metadata records to check for required jobs", tenants.size());

        Map<UUID, Optional<User>> users = new HashMap<>();
        int skipped = 0;
        int created = 0;

        for (TenantMetadata tenant : tenants) {
            try {
                Optional<User> user = users.computeIfAbsent(tenant.getUserId(), userRepository::findById);
                if (user.isEmpty() || !user.get().hasBrain()) {
                    log.warn("Skipping tenant {} - user {} not found or has no brain_id",
                            tenant.getTenantId(), tenant.getUserId());
                    skipped++;
                    continue;
                }
                created += ensureJobs(tenant, user.get());
            } catch (RuntimeException e) {
                log.error("Error reconciling jobs for tenant {}: {}", tenant.getTenantId(), e.getMessage(), e);
                skipped++;
            }
        }
        if (created > 0) {
            log.info("Created {} new jobs for users with connected tenants", created);
        }

        List<ScheduledJob> activeJobs = jobRepository.findByIsActiveTrue();
        log.info("Found {} active jobs to restore on startup", activeJobs.size());

        int restored = 0;
        for (ScheduledJob job : activeJobs) {
            try {
                OffsetDateTime nextRun = installAndQueue(job);
                restored++;
                log.info("Restored {} job {} for user {}. Next run scheduled for {}",
                        job.getJobType().getValue(), job.getId(), job.getUserId(), nextRun);
            } catch (RuntimeException e) {
                log.error("Error restoring job {}: {}", job.getId(), e.getMessage(), e);
            }
        }

        return new ReconciliationSummary(tenants.size(), skipped, created, restored);
    }

    // ================================================================
    // Internals
    // ================================================================

    private int ensureJobs(TenantMetadata tenant, User user) {
        int created = 0;
        registryLock.lock();
        try {
            for (JobType jobType : JobType.values()) {
                Optional<ScheduledJob> existing = jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(
                        tenant.getUserId(), tenant.getTenantId(), jobType);
                if (existing.isPresent()) {
                    log.debug("Job {} already exists for user {}, tenant {}, type {}",
                            existing.get().getId(), tenant.getUserId(), tenant.getTenantId(), jobType.getValue());
                    continue;
                }
                ScheduledJob job = createJob(tenant.getUserId(), tenant.getTenantId(), user.getBrainId(), jobType);
                created++;
                log.info("Created {} job {} for user {}, tenant {}",
                        jobType.getValue(), job.getId(), tenant.getUserId(), tenant.getTenantId());
            }
        } finally {
            registryLock.unlock();
        }
        return created;
    }

    private ScheduledJob createJob(UUID userId, String tenantId, String brainId, JobType jobType) {
        ScheduledJob job = ScheduledJob.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .tenantId(tenantId)
                .brainId(brainId)
                .jobType(jobType)
                .isActive(true)
                .build();
        jobRepository.save(job);
        return job;
    }

    private OffsetDateTime installAndQueue(ScheduledJob job) {
        JobInvocation invocation = JobInvocation.of(job, processors.get(job.getJobType()));
        String name = job.getJobType().displayName() + " Processing for User " + job.getUserId();

        OffsetDateTime nextRun = jobScheduler.register(job.getId(), name, invocation);

        // First run now rather than at the next cron boundary
        jobQueue.enqueue(invocation);
        log.info("Initial run of {} job {} queued for processing", job.getJobType().getValue(), job.getId());
        return nextRun;
    }
}
