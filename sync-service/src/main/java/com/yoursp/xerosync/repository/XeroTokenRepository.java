package com.yoursp.xerosync.repository;

import com.yoursp.xerosync.model.entity.XeroToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface XeroTokenRepository extends JpaRepository<XeroToken, Long> {

    Optional<XeroToken> findFirstByUserIdOrderByExpiresAtDesc(UUID userId);

    @Modifying
    @Transactional
    @Query("DELETE FROM XeroToken t WHERE t.userId = :userId")
    int deleteAllByUserId(UUID userId);

    @Modifying
    @Transactional
    @Query("UPDATE XeroToken t SET t.tenantId = :tenantId WHERE t.userId = :userId")
    int updateTenantId(UUID userId, String tenantId);
}
