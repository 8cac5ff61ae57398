package com.example.profilestore.service;

import com.example.profilestore.model.SinkDelivery;
import com.example.profilestore.profile.SaveSink;
import com.example.profilestore.repo.SinkDeliveryRepo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards every saved profile document to an HTTP endpoint, fire-and-forget.
 * <p>
 * Failed deliveries are parked in MongoDB and retried by {@link SinkOutboxProjector}.
 */
public class HttpSaveSink implements SaveSink {

    private static final Logger logger = LoggerFactory.getLogger(HttpSaveSink.class);

    private final WebClient webClient;
    private final SinkDeliveryRepo deliveryRepo;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpSaveSink(WebClient webClient, SinkDeliveryRepo deliveryRepo, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.deliveryRepo = deliveryRepo;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public void forward(String ownerId, long version, String document) {
        deliver(ownerId, version, document).subscribe(
                ignored -> logger.debug("Forwarded profile {} version {}", ownerId, version),
                error -> park(ownerId, version, document, error));
    }

    /**
     * POST {@code {ownerId, version, document}}; completes empty on a 2xx response.
     */
    public Mono<Void> deliver(String ownerId, long version, String document) {
        Map<String, Object> body;
        try {
            body = new LinkedHashMap<>();
            body.put("ownerId", ownerId);
            body.put("version", version);
            body.put("document", objectMapper.readTree(document));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return webClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .then();
    }

    void park(String ownerId, long version, String document, Throwable error) {
        logger.warn("Forwarding profile {} version {} failed, queued for retry: {}", ownerId, version, error.getMessage());
        try {
            deliveryRepo.save(SinkDelivery.builder()
                    .ownerId(ownerId)
                    .version(version)
                    .payload(document)
                    .ts(Instant.now())
                    .attempts(1)
                    .lastError(error.getMessage())
                    .delivered(false)
                    .build());
        } catch (RuntimeException e) {
            logger.error("Could not queue failed delivery of profile {} version {}", ownerId, version, e);
        }
    }
}
