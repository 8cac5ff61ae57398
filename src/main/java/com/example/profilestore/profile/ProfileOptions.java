package com.example.profilestore.profile;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable settings for a {@link ProfileStore}.
 */
@Value
@Builder(toBuilder = true)
public class ProfileOptions {
    @Builder.Default String storeName = "PlayerData";
    @Builder.Default String storeVersion = "v1";
    @Builder.Default Duration saveInterval = Duration.ofMinutes(5);
    @Builder.Default Set<String> keysToIgnore = Set.of();
    @Builder.Default ProfileTemplate template = ProfileTemplate.empty();

    @Builder.Default boolean persistenceEnabled = true;
    @Builder.Default boolean allowInNonProductionEnv = false;
    @Builder.Default boolean productionEnvironment = true;
    /** Result of the startup connectivity check. */
    @Builder.Default boolean backendAvailable = true;

    @Builder.Default Duration sessionLockTimeout = Duration.ofMinutes(30);
    @Builder.Default Duration sessionCheckInterval = Duration.ofSeconds(5);
    @Builder.Default int maxConnectionAttempts = 3;
    @Builder.Default Duration maxConnectionAttemptDelay = Duration.ofSeconds(2);

    public boolean persistenceActive() {
        return persistenceEnabled
                && backendAvailable
                && (productionEnvironment || allowInNonProductionEnv);
    }
}
