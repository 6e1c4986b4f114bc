package com.yoursp.xerosync.repository;

import com.yoursp.xerosync.model.entity.JobType;
import com.yoursp.xerosync.model.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    Optional<ScheduledJob> findFirstByUserIdAndTenantIdAndJobTypeAndIsActiveTrue(
            UUID userId, String tenantId, JobType jobType);

    List<ScheduledJob> findByUserIdAndTenantIdAndIsActiveTrue(UUID userId, String tenantId);

    List<ScheduledJob> findByIsActiveTrue();
}
