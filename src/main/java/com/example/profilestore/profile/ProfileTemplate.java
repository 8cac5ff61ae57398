package com.example.profilestore.profile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the default document for an owner. Each call must return a fresh instance.
 */
@FunctionalInterface
public interface ProfileTemplate {

    Map<String, Object> create(String ownerId);

    static ProfileTemplate of(Map<String, Object> document) {
        Map<String, Object> frozen = DocumentPaths.copyMap(document);
        return ownerId -> DocumentPaths.copyMap(frozen);
    }

    static ProfileTemplate empty() {
        return ownerId -> new LinkedHashMap<>();
    }
}
