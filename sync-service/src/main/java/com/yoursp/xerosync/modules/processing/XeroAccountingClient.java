package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.config.XeroProperties;
import com.yoursp.xerosync.modules.processing.dto.InvoicePage;
import com.yoursp.xerosync.modules.token.dto.XeroTokenData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/**
 * Minimal client for the Xero accounting API, only what the job bodies read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class XeroAccountingClient {

    private static final String TENANT_HEADER = "Xero-tenant-id";

    private final RestTemplate restTemplate;
    private final XeroProperties xeroProperties;

    /**
     * Fetch one page of invoices (full detail, not summary).
     */
    @SuppressWarnings("unchecked")
    public InvoicePage getInvoices(XeroTokenData token, String tenantId, int page, int pageSize) {
        String url = UriComponentsBuilder.fromHttpUrl(xeroProperties.getInvoicesUrl())
                .queryParam("page", page)
                .queryParam("pageSize", pageSize)
                .queryParam("summaryOnly", false)
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, token.authorizationHeader());
        headers.set(TENANT_HEADER, tenantId);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        @SuppressWarnings("rawtypes")
        ResponseEntity<Map> response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), Map.class);

        Map<String, Object> body = response.getBody();
        if (body == null) {
            return new InvoicePage(List.of(), page, page);
        }

        List<Map<String, Object>> invoices = body.get("Invoices") instanceof List<?> list
                ? (List<Map<String, Object>>) list
                : List.of();

        Integer pageCount = null;
        int currentPage = page;
        if (body.get("pagination") instanceof Map<?, ?> pagination) {
            if (pagination.get("page") instanceof Number n) {
                currentPage = n.intValue();
            }
            if (pagination.get("pageCount") instanceof Number n) {
                pageCount = n.intValue();
            }
        }
        return new InvoicePage(invoices, currentPage, pageCount);
    }
}
