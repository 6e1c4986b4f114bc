package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.config.BrainProperties;
import com.yoursp.xerosync.modules.processing.dto.BrainProcessRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrainApiClientTest {

    private BrainApiClient brainApiClient;

    @BeforeEach
    void setUp() {
        BrainProperties properties = new BrainProperties();
        properties.setBaseUrl("http://localhost:1");
        properties.setApiKey("brain-key");
        brainApiClient = new BrainApiClient(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("Unreachable brain service → call fails")
    void unreachableServiceFails() {
        BrainProcessRequest request = new BrainProcessRequest(List.of(Map.of("InvoiceID", "1")), "brain-1",
                "invoice");

        // Nothing listens on port 1; without the proxy the raw client error surfaces
        assertThrows(Exception.class, () -> brainApiClient.process(request));
    }

    @Test
    @DisplayName("Fallback converts any failure into BrainApiUnavailableException")
    void fallbackThrowsUnavailable() {
        BrainProcessRequest request = new BrainProcessRequest(List.of(), "brain-1", "statement");

        BrainApiUnavailableException ex = assertThrows(BrainApiUnavailableException.class,
                () -> ReflectionTestUtils.invokeMethod(brainApiClient, "processFallback", request,
                        new IllegalStateException("Connection refused")));
        assertTrue(ex.getMessage().contains("Connection refused"));
    }
}
