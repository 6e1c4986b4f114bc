package com.yoursp.xerosync.modules.processing;

import com.yoursp.xerosync.config.BrainProperties;
import com.yoursp.xerosync.modules.processing.dto.BrainProcessRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Forwards fetched batches to the brain service.
 * <ul>
 * <li>POST {brain.base-url}/v1/file/xero/process with the brain API key</li>
 * <li>Circuit breaker: stops hammering the brain service while it is down</li>
 * </ul>
 */
@Slf4j
@Component
public class BrainApiClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(3);

    private final WebClient webClient;
    private final BrainProperties brainProperties;

    public BrainApiClient(WebClient.Builder webClientBuilder, BrainProperties brainProperties) {
        this.webClient = webClientBuilder.build();
        this.brainProperties = brainProperties;
    }

    /**
     * Send one batch. Blocks until the brain service answers.
     *
     * @return the brain service's JSON response
     */
    @CircuitBreaker(name = "brainApi", fallbackMethod = "processFallback")
    public Map<String, Object> process(BrainProcessRequest request) {
        log.info("Sending {} {} record(s) to brain {}", request.data().size(), request.documentType(),
                request.brainId());

        Map<String, Object> response = webClient.post()
                .uri(brainProperties.getProcessUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBearerAuth(brainProperties.getApiKey()))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {
                })
                .block(REQUEST_TIMEOUT);

        log.info("Successfully processed xero {} batch for brain {}", request.documentType(), request.brainId());
        return response;
    }

    @SuppressWarnings("unused")
    private Map<String, Object> processFallback(BrainProcessRequest request, Throwable t) {
        log.error("Brain API call failed for brain {} ({}): {}", request.brainId(), request.documentType(),
                t.getMessage());
        throw new BrainApiUnavailableException("Brain service unavailable: " + t.getMessage(), t);
    }
}
