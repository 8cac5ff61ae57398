package com.example.profilestore.service;

import com.example.profilestore.model.SessionData;
import com.example.profilestore.profile.Profile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain-map views of a profile for the HTTP and MCP surfaces.
 */
public final class ProfileViews {

    private ProfileViews() {
        // utility
    }

    public static Map<String, Object> status(Profile profile) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ownerId", profile.getOwnerId());
        out.put("state", profile.getState().name());
        out.put("new", profile.isNew());
        out.put("persistenceEnabled", profile.isPersistenceEnabled());
        out.put("sessions", profile.getSessions());
        out.put("created", profile.getCreated());
        out.put("lastSeen", profile.getLastSeen());
        out.put("lastSave", profile.getLastSave());
        SessionData lock = profile.getSessionData();
        out.put("lockOwner", lock == null ? null : lock.getOwnerToken());
        out.put("lockUpdatedAt", lock == null ? null : lock.getLastUpdate());
        return out;
    }

    public static Map<String, Object> value(String ownerId, String path, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ownerId", ownerId);
        out.put("path", path);
        out.put("value", value);
        return out;
    }
}
