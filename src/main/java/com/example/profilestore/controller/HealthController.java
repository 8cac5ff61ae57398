package com.example.profilestore.controller;

import com.example.profilestore.repo.SinkDeliveryRepo;
import com.example.profilestore.service.BackendStatus;
import com.example.profilestore.service.ProfileManager;
import com.example.profilestore.store.RemoteStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final RemoteStore remoteStore;
    private final SinkDeliveryRepo deliveryRepo;
    private final BackendStatus backendStatus;
    private final ProfileManager profileManager;

    public HealthController(RemoteStore remoteStore, SinkDeliveryRepo deliveryRepo,
                            BackendStatus backendStatus, ProfileManager profileManager) {
        this.remoteStore = remoteStore;
        this.deliveryRepo = deliveryRepo;
        this.backendStatus = backendStatus;
        this.profileManager = profileManager;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "profile-store");
        health.put("version", "0.1.0");
        health.put("persistenceAvailableAtStartup", backendStatus.isAvailable());
        health.put("persistenceActive", profileManager.getStore().getOptions().persistenceActive());
        health.put("liveProfiles", profileManager.liveProfiles().size());

        // Test Redis connection
        try {
            remoteStore.ping();
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        // Test MongoDB connection
        try {
            health.put("pendingSinkDeliveries", deliveryRepo.countByDeliveredFalse());
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
