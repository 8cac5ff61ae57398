package com.example.profilestore.service;

import com.example.profilestore.config.ProfileStoreProperties;
import com.example.profilestore.model.SinkDelivery;
import com.example.profilestore.repo.SinkDeliveryRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.List;

/**
 * Retries sink deliveries that failed when first forwarded. Registered only when an
 * external sink is configured.
 */
public class SinkOutboxProjector {

    private static final Logger logger = LoggerFactory.getLogger(SinkOutboxProjector.class);

    private final SinkDeliveryRepo deliveryRepo;
    private final HttpSaveSink sink;
    private final int maxAttempts;
    private final Duration timeout;

    public SinkOutboxProjector(SinkDeliveryRepo deliveryRepo, HttpSaveSink sink, ProfileStoreProperties properties) {
        this.deliveryRepo = deliveryRepo;
        this.sink = sink;
        this.maxAttempts = properties.getSinkMaxAttempts();
        this.timeout = properties.getSinkTimeout();
    }

    @Scheduled(fixedDelay = 30000L, initialDelay = 10000L)
    public void run() {
        List<SinkDelivery> pending = deliveryRepo.findTop50ByDeliveredFalseAndAttemptsLessThanOrderByTsAsc(maxAttempts);
        for (SinkDelivery d : pending) {
            try {
                sink.deliver(d.getOwnerId(), d.getVersion(), d.getPayload()).block(timeout.plusSeconds(1));
                d.setDelivered(true);
                d.setLastError(null);
            } catch (RuntimeException e) {
                d.setLastError(e.getMessage());
                if (d.getAttempts() + 1 >= maxAttempts) {
                    logger.error("Giving up forwarding profile {} version {} after {} attempts",
                            d.getOwnerId(), d.getVersion(), d.getAttempts() + 1);
                }
            }
            d.setAttempts(d.getAttempts() + 1);
            deliveryRepo.save(d);
        }
    }
}
