package com.example.profilestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted version of a profile. {@code sessionData == null} means unlocked.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProfileMetadata {
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    private long created;
    @JsonProperty("last_seen")
    private long lastSeen;
    private long sessions;
    private SessionData sessionData;
}
