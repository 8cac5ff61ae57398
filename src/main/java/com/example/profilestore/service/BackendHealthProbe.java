package com.example.profilestore.service;

import com.example.profilestore.config.ProfileStoreProperties;
import com.example.profilestore.store.RemoteStore;
import com.example.profilestore.store.StoreRetrier;
import com.example.profilestore.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class BackendHealthProbe {

    private static final Logger logger = LoggerFactory.getLogger(BackendHealthProbe.class);

    private final RemoteStore remote;
    private final ProfileStoreProperties properties;
    private final Clock clock;

    public BackendHealthProbe(RemoteStore remote, ProfileStoreProperties properties, Clock clock) {
        this.remote = remote;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Ping the remote store with the configured retry budget.
     */
    public BackendStatus probe() {
        StoreRetrier retrier = new StoreRetrier(properties.getMaxConnectionAttempts(), properties.getMaxConnectionAttemptDelay());
        try {
            retrier.run("ping", remote::ping);
            logger.info("Remote store reachable; profile persistence available");
            return BackendStatus.up(clock.instant());
        } catch (StoreUnavailableException e) {
            logger.warn("Remote store unreachable at startup; profiles will not be persisted: {}", e.getMessage());
            return BackendStatus.down(clock.instant(), e.getMessage());
        }
    }
}
