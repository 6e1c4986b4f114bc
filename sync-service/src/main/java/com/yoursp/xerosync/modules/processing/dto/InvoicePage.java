package com.yoursp.xerosync.modules.processing.dto;

import java.util.List;
import java.util.Map;

/**
 * One page of the Xero Invoices endpoint.
 *
 * @param pageCount total pages reported by Xero, or null when the response had no pagination block
 */
public record InvoicePage(List<Map<String, Object>> invoices, int page, Integer pageCount) {

    public boolean isLast(int pageSize) {
        if (pageCount != null) {
            return page >= pageCount;
        }
        return invoices.size() < pageSize;
    }
}
