package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.model.entity.JobType;
import com.yoursp.xerosync.modules.processing.dto.BrainProcessRequest;
import com.yoursp.xerosync.modules.processing.dto.InvoicePage;
import com.yoursp.xerosync.modules.token.XeroTokenManager;
import com.yoursp.xerosync.modules.token.dto.XeroTokenData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Pulls every invoice of a tenant from Xero and forwards them as one batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvoiceProcessor implements TenantJobProcessor {

    static final int PAGE_SIZE = 100;
    static final String DOCUMENT_TYPE = "invoice";

    private final XeroTokenManager tokenManager;
    private final XeroAccountingClient accountingClient;
    private final BrainApiClient brainApiClient;

    @Override
    public JobType jobType() {
        return JobType.INVOICE;
    }

    @Override
    public Map<String, Object> process(UUID userId, String brainId, String tenantId) {
        log.info("Starting invoice processing for brain {}, tenant {}", brainId, tenantId);
        if (tenantId == null || tenantId.isBlank()) {
            log.error("No organisation tenant given for user {}", userId);
            return null;
        }

        try {
            Optional<XeroTokenData> token = tokenManager.getCurrentToken(userId);
            if (token.isEmpty()) {
                log.warn("No valid Xero token for user {}, skipping invoice run for tenant {}", userId, tenantId);
                return null;
            }

            List<Map<String, Object>> invoices = fetchAllInvoices(token.get(), tenantId);
            if (cancelled(tenantId)) {
                return null;
            }
            if (invoices.isEmpty()) {
                log.info("No invoices to process for brain {}", brainId);
                return null;
            }

            log.info("Processing all {} invoices", invoices.size());
            Map<String, Object> result = brainApiClient.process(
                    new BrainProcessRequest(invoices, brainId, DOCUMENT_TYPE));
            log.info("Successfully processed {} invoices", invoices.size());
            return result;

        } catch (Exception e) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Invoice run for tenant {} cancelled: {}", tenantId, e.getMessage());
                return null;
            }
            log.error("Error processing Xero invoices for tenant {}: {}", tenantId, e.getMessage(), e);
            return null;
        }
    }

    /**
     * Stops early, with what it has, when the run is cancelled between pages.
     */
    private List<Map<String, Object>> fetchAllInvoices(XeroTokenData token, String tenantId) {
        List<Map<String, Object>> all = new ArrayList<>();
        int page = 1;
        while (!Thread.currentThread().isInterrupted()) {
            log.debug("Fetching page {} of invoices", page);
            InvoicePage result = accountingClient.getInvoices(token, tenantId, page, PAGE_SIZE);
            all.addAll(result.invoices());
            log.info("Fetched {} invoices from page {}/{}", result.invoices().size(), result.page(),
                    result.pageCount() != null ? result.pageCount() : "?");
            if (result.isLast(PAGE_SIZE)) {
                return all;
            }
            page = result.page() + 1;
        }
        return all;
    }

    private static boolean cancelled(String tenantId) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Invoice run for tenant {} cancelled, nothing sent to brain", tenantId);
            return true;
        }
        return false;
    }
}
