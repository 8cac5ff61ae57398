package com.example.profilestore.profile;

import com.example.profilestore.model.ProfileMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;

/**
 * JSON encoding of {@link ProfileMetadata}.
 */
public class ProfileCodec {

    private final ObjectMapper objectMapper;

    public ProfileCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProfileMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Profile document is not JSON-representable: " + e.getOriginalMessage(), e);
        }
    }

    public ProfileMetadata decode(String payload) {
        if (payload == null) {
            throw new ProfileDecodeException("Profile document is missing");
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new ProfileDecodeException("Profile document is not a JSON object");
            }
            JsonNode data = node.get("data");
            if (data != null && !data.isNull() && !data.isObject()) {
                throw new ProfileDecodeException("Profile data is not a JSON object");
            }
            ProfileMetadata metadata = objectMapper.treeToValue(node, ProfileMetadata.class);
            if (metadata.getData() == null) {
                metadata.setData(new LinkedHashMap<>());
            }
            return metadata;
        } catch (JsonProcessingException e) {
            throw new ProfileDecodeException("Profile document could not be parsed: " + e.getOriginalMessage(), e);
        }
    }
}
