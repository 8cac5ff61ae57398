package com.example.profilestore.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code profiles.*}.
 */
@Data
@ConfigurationProperties(prefix = "profiles")
public class ProfileStoreProperties {
    private String storeName = "PlayerData";
    private String storeVersion = "v1";
    private Duration saveInterval = Duration.ofMinutes(5);
    private List<String> keysToIgnore = new ArrayList<>();
    private Map<String, Object> template = new LinkedHashMap<>();

    private boolean persistenceEnabled = true;
    private boolean allowInNonProductionEnv = false;
    private String environment = "production";

    private String externalSinkUrl;
    private Duration sinkTimeout = Duration.ofSeconds(5);
    private int sinkMaxAttempts = 5;

    private Duration sessionLockTimeout = Duration.ofMinutes(30);
    private Duration sessionCheckInterval = Duration.ofSeconds(5);
    private int maxConnectionAttempts = 3;
    private Duration maxConnectionAttemptDelay = Duration.ofSeconds(2);

    private boolean reconcileOnLoad = true;

    // Unique per process unless pinned; identifies this server in session locks.
    private String serverToken;

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }
}
