package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.model.entity.JobType;
import com.yoursp.xerosync.modules.processing.dto.BrainProcessRequest;
import com.yoursp.xerosync.repository.StatementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Forwards a tenant's uploaded bank statement lines. Reads the local
 * statements table only, so no Xero credential is needed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementProcessor implements TenantJobProcessor {

    static final String DOCUMENT_TYPE = "statement";

    private final StatementRepository statementRepository;
    private final BrainApiClient brainApiClient;

    @Override
    public JobType jobType() {
        return JobType.STATEMENT;
    }

    @Override
    public Map<String, Object> process(UUID userId, String brainId, String tenantId) {
        log.info("Starting statement processing for brain {}, tenant {}", brainId, tenantId);
        try {
            List<Map<String, Object>> statements = statementRepository.findByTenantId(tenantId);
            if (statements.isEmpty()) {
                log.info("No statements to process for brain {}", brainId);
                return null;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Statement run for tenant {} cancelled, nothing sent to brain", tenantId);
                return null;
            }

            Map<String, Object> result = brainApiClient.process(
                    new BrainProcessRequest(statements, brainId, DOCUMENT_TYPE));
            log.info("Successfully processed {} statements", statements.size());
            return result;

        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Statement run for tenant {} cancelled: {}", tenantId, e.getMessage());
                return null;
            }
            log.error("Error processing statements for tenant {}: {}", tenantId, e.getMessage(), e);
            return null;
        }
    }
}
