package com.yoursp.xerosync.repository;

import com.yoursp.xerosync.model.entity.TenantMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantMetadataRepository extends JpaRepository<TenantMetadata, Long> {

    Optional<TenantMetadata> findByTenantIdAndUserId(String tenantId, UUID userId);
}
