package com.yoursp.xerosync.modules.processing.dto;

import java.util.List;
import java.util.Map;

/**
 * Batch payload accepted by the brain service's Xero process endpoint.
 */
public record BrainProcessRequest(
        List<Map<String, Object>> data,
        String brainId,
        String documentType) {
}
