package com.yoursp.xerosync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code brain.*} YAML properties (downstream processing service).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "brain")
public class BrainProperties {

    private String baseUrl;
    private String apiKey;

    public String getProcessUrl() {
        return baseUrl + "/v1/file/xero/process";
    }
}
