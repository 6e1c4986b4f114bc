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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobManagerTest {

    private static final UUID USER_ID = UUID.fromString("0f8e2d9c-1b3a-4c5d-8e7f-6a5b4c3d2e1f");
    private static final String TENANT_ID = "a3c1e0f2-5b7d-4e9a-b1c3-d5e7f9a1b3c5";

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private TenantMetadataRepository tenantMetadataRepository;

    @Mock
    private JobScheduler jobScheduler;

    @Mock
    private JobQueue jobQueue;

    @Mock
    private XeroTokenManager tokenManager;

    @Mock
    private TenantJobProcessor invoiceProcessor;

    @Mock
    private TenantJobProcessor statementProcessor;

    private JobManager jobManager;

    @BeforeEach
    void setUp() {
        when(invoiceProcessor.jobType()).thenReturn(JobType.INVOICE);
        when(statementProcessor.jobType()).thenReturn(JobType.STATEMENT);
        jobManager = new JobManager(jobRepository, userRepository, tenantMetadataRepository, jobScheduler,
                jobQueue, tokenManager, new ScheduleProperties(), List.of(invoiceProcessor, statementProcessor));
    }

    @Test
    @DisplayName("Missing processor for a job type fails construction")
    void missingProcessorRejected() {
        assertThrows(IllegalStateException.class, () -> new JobManager(jobRepository, userRepository,
                tenantMetadataRepository, jobScheduler, jobQueue, tokenManager, new ScheduleProperties(),
                List.of(invoiceProcessor)));
    }

    @Test
    @DisplayName("Starting a new job persists it, registers a trigger and queues a first run")
    void startCreatesJob() {
        givenUser("brain-42");
        givenTenant();
        when(jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(USER_ID, TENANT_ID, JobType.INVOICE))
                .thenReturn(Optional.empty());
        OffsetDateTime next = OffsetDateTime.now().plusHours(6);
        when(jobScheduler.register(anyString(), anyString(), any(JobInvocation.class))).thenReturn(next);

        JobStartResult result = jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE);

        assertEquals("success", result.getStatus());
        assertFalse(result.isAlreadyScheduled());
        assertEquals("every 6 hours", result.getScheduleDescription());
        assertEquals(next, result.getNextRun());
        assertEquals("Invoice processing started and will run every 6 hours", result.getMessage());

        ArgumentCaptor<ScheduledJob> saved = ArgumentCaptor.forClass(ScheduledJob.class);
        verify(jobRepository).save(saved.capture());
        ScheduledJob job = saved.getValue();
        assertEquals(result.getJobId(), job.getId());
        assertEquals("brain-42", job.getBrainId());
        assertEquals(JobType.INVOICE, job.getJobType());
        assertTrue(job.isActive());

        ArgumentCaptor<JobInvocation> queued = ArgumentCaptor.forClass(JobInvocation.class);
        verify(jobScheduler).register(eq(job.getId()), eq("Invoice Processing for User " + USER_ID),
                any(JobInvocation.class));
        verify(jobQueue).enqueue(queued.capture());
        assertSame(invoiceProcessor, queued.getValue().processor());
        assertEquals(TENANT_ID, queued.getValue().tenantId());
    }

    @Test
    @DisplayName("Starting an already active job returns the existing id without side effects")
    void startIsIdempotent() {
        givenUser("brain-42");
        givenTenant();
        ScheduledJob existing = job("existing-id", JobType.STATEMENT);
        when(jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(USER_ID, TENANT_ID,
                JobType.STATEMENT)).thenReturn(Optional.of(existing));
        when(jobScheduler.nextFireTime("existing-id")).thenReturn(Optional.empty());

        JobStartResult result = jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.STATEMENT);

        assertEquals("existing-id", result.getJobId());
        assertTrue(result.isAlreadyScheduled());
        assertEquals("Statement processing is already scheduled", result.getMessage());
        verify(jobRepository, never()).save(any());
        verify(jobScheduler, never()).register(anyString(), anyString(), any());
        verifyNoInteractions(jobQueue);
    }

    @Test
    @DisplayName("Starting the same job twice yields one row, one trigger and one queued run")
    void startTwiceKeepsSingleJob() {
        List<ScheduledJob> registry = fakeRegistry();
        givenUser("brain-42");
        givenTenant();

        JobStartResult first = jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE);
        JobStartResult second = jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE);

        assertEquals(first.getJobId(), second.getJobId());
        assertFalse(first.isAlreadyScheduled());
        assertTrue(second.isAlreadyScheduled());
        assertEquals(1, registry.size());
        verify(jobScheduler, times(1)).register(anyString(), anyString(), any(JobInvocation.class));
        verify(jobQueue, times(1)).enqueue(any(JobInvocation.class));
    }

    @Test
    @DisplayName("Unknown user is reported as not found")
    void startUnknownUser() {
        when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

        assertThrows(UserNotFoundException.class,
                () -> jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE));
        verifyNoInteractions(jobRepository);
    }

    @Test
    @DisplayName("User without a brain id cannot start jobs")
    void startWithoutBrain() {
        givenUser(null);

        assertThrows(JobConfigurationException.class,
                () -> jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE));
        verifyNoInteractions(jobRepository, jobScheduler, jobQueue);
    }

    @Test
    @DisplayName("Tenant the user never connected is rejected")
    void startUnknownTenant() {
        givenUser("brain-42");
        when(tenantMetadataRepository.findByTenantIdAndUserId(TENANT_ID, USER_ID)).thenReturn(Optional.empty());

        assertThrows(TenantNotFoundException.class,
                () -> jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE));
        verifyNoInteractions(jobRepository);
    }

    @Test
    @DisplayName("Unexpected registry failure surfaces as JobOperationException")
    void startRegistryFailure() {
        givenUser("brain-42");
        givenTenant();
        when(jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThrows(JobOperationException.class,
                () -> jobManager.startJobForUser(USER_ID, TENANT_ID, JobType.INVOICE));
    }

    @Test
    @DisplayName("Activating a tenant records it and starts both job types")
    void activateTenantStartsAllJobs() {
        givenUser("brain-42");
        givenTenant();
        when(tokenManager.setActiveTenant(USER_ID, TENANT_ID)).thenReturn(true);
        when(jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(eq(USER_ID), eq(TENANT_ID), any()))
                .thenReturn(Optional.empty());

        Map<JobType, JobStartResult> results = jobManager.activateTenant(USER_ID, TENANT_ID);

        assertEquals(2, results.size());
        verify(jobRepository, times(2)).save(any(ScheduledJob.class));
        verify(jobQueue, times(2)).enqueue(any(JobInvocation.class));
    }

    @Test
    @DisplayName("Activating a tenant without a stored credential fails")
    void activateTenantWithoutCredential() {
        givenTenant();
        when(tokenManager.setActiveTenant(USER_ID, TENANT_ID)).thenReturn(false);

        assertThrows(MissingCredentialException.class, () -> jobManager.activateTenant(USER_ID, TENANT_ID));
        verifyNoInteractions(jobRepository);
    }

    @Test
    @DisplayName("Active jobs are listed per user and tenant")
    void findActiveJobs() {
        List<ScheduledJob> active = List.of(job("inv-1", JobType.INVOICE), job("stmt-1", JobType.STATEMENT));
        when(jobRepository.findByUserIdAndTenantIdAndIsActiveTrue(USER_ID, TENANT_ID)).thenReturn(active);

        assertEquals(active, jobManager.findActiveJobs(USER_ID, TENANT_ID));
        assertEquals("every 6 hours", jobManager.describeSchedule());
    }

    @Test
    @DisplayName("Stop deactivates the row even when no trigger is live")
    void stopWithoutTrigger() {
        ScheduledJob job = job("job-7", JobType.INVOICE);
        when(jobRepository.findById("job-7")).thenReturn(Optional.of(job));
        doThrow(new TriggerNotFoundException("job-7")).when(jobScheduler).remove("job-7");

        JobStopResult result = jobManager.stopJob("job-7");

        assertFalse(job.isActive());
        verify(jobRepository).save(job);
        assertFalse(result.triggerRemoved());
        assertEquals("Invoice processing stopped successfully", result.message());
    }

    @Test
    @DisplayName("Stop removes a live trigger")
    void stopRemovesTrigger() {
        ScheduledJob job = job("job-8", JobType.STATEMENT);
        when(jobRepository.findById("job-8")).thenReturn(Optional.of(job));

        JobStopResult result = jobManager.stopJob("job-8");

        assertTrue(result.triggerRemoved());
        verify(jobScheduler).remove("job-8");
    }

    @Test
    @DisplayName("Stopping an unknown job is reported as not found")
    void stopUnknownJob() {
        when(jobRepository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(JobNotFoundException.class, () -> jobManager.stopJob("nope"));
        verifyNoInteractions(jobScheduler);
    }

    @Test
    @DisplayName("Startup reconciliation is idempotent across runs")
    void reconciliationIsIdempotent() {
        List<ScheduledJob> registry = fakeRegistry();
        when(tenantMetadataRepository.findAll()).thenReturn(List.of(tenant(USER_ID, TENANT_ID)));
        givenUser("brain-42");

        ReconciliationSummary first = jobManager.startJobsOnStartup();
        ReconciliationSummary second = jobManager.startJobsOnStartup();

        assertEquals(new ReconciliationSummary(1, 0, 2, 2), first);
        assertEquals(new ReconciliationSummary(1, 0, 0, 2), second);
        assertEquals(2, registry.size());
        verify(jobRepository, times(2)).save(any(ScheduledJob.class));
        verify(jobScheduler, times(4)).register(anyString(), anyString(), any(JobInvocation.class));
    }

    @Test
    @DisplayName("Reconciliation skips tenants whose user is missing or has no brain")
    void reconciliationSkipsUnusableTenants() {
        UUID orphanUser = UUID.randomUUID();
        UUID brainlessUser = UUID.randomUUID();
        when(tenantMetadataRepository.findAll()).thenReturn(List.of(
                tenant(orphanUser, "tenant-a"),
                tenant(brainlessUser, "tenant-b")));
        when(userRepository.findById(orphanUser)).thenReturn(Optional.empty());
        when(userRepository.findById(brainlessUser))
                .thenReturn(Optional.of(User.builder().id(brainlessUser).email("x@example.com").build()));
        when(jobRepository.findByIsActiveTrue()).thenReturn(List.of());

        ReconciliationSummary summary = jobManager.startJobsOnStartup();

        assertEquals(new ReconciliationSummary(2, 2, 0, 0), summary);
        verify(jobRepository, never()).save(any());
        verifyNoInteractions(jobScheduler, jobQueue);
    }

    @Test
    @DisplayName("Reconciliation restores rows created before the restart")
    void reconciliationRestoresExistingRows() {
        when(tenantMetadataRepository.findAll()).thenReturn(List.of());
        when(jobRepository.findByIsActiveTrue())
                .thenReturn(List.of(job("inv-1", JobType.INVOICE), job("stmt-1", JobType.STATEMENT)));

        ReconciliationSummary summary = jobManager.startJobsOnStartup();

        assertEquals(2, summary.jobsRestored());
        verify(jobScheduler).register(eq("inv-1"), anyString(), any(JobInvocation.class));
        verify(jobScheduler).register(eq("stmt-1"), anyString(), any(JobInvocation.class));
        verify(jobQueue, times(2)).enqueue(any(JobInvocation.class));
    }

    // ---------------------------------------------------------------

    private void givenUser(String brainId) {
        User user = User.builder().id(USER_ID).email("owner@example.com").brainId(brainId).isActive(true).build();
        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));
    }

    private void givenTenant() {
        when(tenantMetadataRepository.findByTenantIdAndUserId(TENANT_ID, USER_ID))
                .thenReturn(Optional.of(tenant(USER_ID, TENANT_ID)));
    }

    private static TenantMetadata tenant(UUID userId, String tenantId) {
        return TenantMetadata.builder()
                .userId(userId)
                .tenantId(tenantId)
                .tenantName("Demo Company (AU)")
                .tableName("demo_company_au")
                .build();
    }

    private static ScheduledJob job(String id, JobType jobType) {
        return ScheduledJob.builder()
                .id(id)
                .userId(USER_ID)
                .tenantId(TENANT_ID)
                .brainId("brain-42")
                .jobType(jobType)
                .isActive(true)
                .build();
    }

    /** Backs the registry lookups with an in-memory list. */
    private List<ScheduledJob> fakeRegistry() {
        List<ScheduledJob> rows = new ArrayList<>();
        lenient().when(jobRepository.save(any(ScheduledJob.class))).thenAnswer(inv -> {
            ScheduledJob job = inv.getArgument(0);
            rows.add(job);
            return job;
        });
        lenient().when(jobRepository.findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(any(), any(), any()))
                .thenAnswer(inv -> rows.stream()
                        .filter(j -> j.getUserId().equals(inv.getArgument(0))
                                && j.getTenantId().equals(inv.getArgument(1))
                                && j.getJobType() == inv.getArgument(2)
                                && j.isActive())
                        .findFirst());
        lenient().when(jobRepository.findByIsActiveTrue())
                .thenAnswer(inv -> rows.stream().filter(ScheduledJob::isActive).toList());
        return rows;
    }
}
