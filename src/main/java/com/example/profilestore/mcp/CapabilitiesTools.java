package com.example.profilestore.mcp;

import com.example.profilestore.profile.ProfileOptions;
import com.example.profilestore.service.ProfileManager;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    private final ProfileManager profileManager;

    public CapabilitiesTools(ProfileManager profileManager) {
        this.profileManager = profileManager;
    }

    @Tool(description = "Describe this profile server: tools, store layout and persistence settings")
    public Map<String, Object> capabilities_list() {
        ProfileOptions options = profileManager.getStore().getOptions();
        Map<String, Object> store = new LinkedHashMap<>();
        store.put("storeName", options.getStoreName());
        store.put("storeVersion", options.getStoreVersion());
        store.put("persistenceActive", options.persistenceActive());
        store.put("saveIntervalSeconds", options.getSaveInterval().toSeconds());
        store.put("sessionLockTimeoutSeconds", options.getSessionLockTimeout().toSeconds());
        store.put("liveProfiles", profileManager.liveProfiles().size());

        return Map.of(
                "server", Map.of("name", "profile-store", "version", "0.1.0"),
                "tools", List.of("profile_get", "profile_set", "profile_increment", "profile_status", "profile_list"),
                "store", store
        );
    }
}
