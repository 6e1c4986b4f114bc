package com.yoursp.xerosync.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads uploaded bank statement lines for a tenant. The statements table is
 * owned by the upload pipeline, so it is queried directly rather than mapped.
 */
@Repository
@RequiredArgsConstructor
public class StatementRepository {

    private static final String SELECT_BY_TENANT = """
            SELECT client_name, account_name, transaction_date, payee,
                   particulars, received, file_name
            FROM statements
            WHERE tenant_id = :tenantId
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public List<Map<String, Object>> findByTenantId(String tenantId) {
        return jdbcTemplate.query(SELECT_BY_TENANT, Map.of("tenantId", tenantId), (rs, rowNum) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("client_name", rs.getString("client_name"));
            row.put("account_name", rs.getString("account_name"));
            Date transactionDate = rs.getDate("transaction_date");
            row.put("transaction_date", transactionDate != null ? transactionDate.toLocalDate().toString() : null);
            row.put("payee", rs.getString("payee"));
            row.put("particulars", rs.getString("particulars"));
            BigDecimal received = rs.getBigDecimal("received");
            row.put("received", received != null ? received.doubleValue() : 0.0);
            row.put("file_name", rs.getString("file_name"));
            return row;
        });
    }
}
