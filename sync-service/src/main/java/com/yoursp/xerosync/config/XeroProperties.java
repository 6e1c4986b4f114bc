package com.yoursp.xerosync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code xero.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "xero")
public class XeroProperties {

    private String clientId;
    private String clientSecret;
    private String tokenEndpoint = "https://identity.xero.com/connect/token";
    private String apiBaseUrl = "https://api.xero.com";

    /** Scope recorded on a token when the provider response does not carry one. */
    private String scope;

    /** Convenience: invoices endpoint of the accounting API */
    public String getInvoicesUrl() {
        return apiBaseUrl + "/api.xro/2.0/Invoices";
    }
}
