package com.example.profilestore.mcp;

import com.example.profilestore.profile.Profile;
import com.example.profilestore.service.ProfileManager;
import com.example.profilestore.service.ProfileViews;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ProfileTools {

    private final ProfileManager profileManager;
    private final ObjectMapper objectMapper;

    public ProfileTools(ProfileManager profileManager, ObjectMapper objectMapper) {
        this.profileManager = profileManager;
        this.objectMapper = objectMapper;
    }

    @Tool(description = "Read a loaded profile, whole or at a dot-separated path")
    public Map<String, Object> profile_get(String ownerId, String path) {
        Optional<Profile> profile = profileManager.find(ownerId);
        if (profile.isEmpty()) return notAttached(ownerId);
        return ProfileViews.value(ownerId, path, profile.get().get(path));
    }

    @Tool(description = "Set a value (JSON text) at a dot-separated path of a loaded profile; '++' appends, '--' removes a 1-based index")
    public Map<String, Object> profile_set(String ownerId, String path, String valueJson) {
        Optional<Profile> profile = profileManager.find(ownerId);
        if (profile.isEmpty()) return notAttached(ownerId);
        Object value;
        try {
            value = valueJson == null ? null : objectMapper.readValue(valueJson, Object.class);
        } catch (JsonProcessingException e) {
            return Map.of("ok", false, "error", "valueJson is not valid JSON: " + e.getOriginalMessage());
        }
        Map<String, Object> result = new HashMap<>();
        result.put("ok", profile.get().set(path, value));
        result.put("value", profile.get().get(path));
        return result;
    }

    @Tool(description = "Add a numeric delta to the number at a dot-separated path of a loaded profile")
    public Map<String, Object> profile_increment(String ownerId, String path, Double delta) {
        Optional<Profile> profile = profileManager.find(ownerId);
        if (profile.isEmpty()) return notAttached(ownerId);
        if (delta == null) return Map.of("ok", false, "error", "delta is required");
        Number d = delta == Math.rint(delta) ? (Number) delta.longValue() : delta;
        Map<String, Object> result = new HashMap<>();
        result.put("ok", profile.get().increment(path, d));
        result.put("value", profile.get().get(path));
        return result;
    }

    @Tool(description = "Session lock and persistence status of a loaded profile")
    public Map<String, Object> profile_status(String ownerId) {
        return profileManager.find(ownerId).map(ProfileViews::status).orElseGet(() -> notAttached(ownerId));
    }

    @Tool(description = "List profiles loaded by this server")
    public Map<String, Object> profile_list() {
        List<Map<String, Object>> live = profileManager.liveProfiles().stream().map(ProfileViews::status).toList();
        return Map.of("profiles", live, "count", live.size());
    }

    private static Map<String, Object> notAttached(String ownerId) {
        return Map.of("ok", false, "error", "Profile " + ownerId + " is not attached");
    }
}
