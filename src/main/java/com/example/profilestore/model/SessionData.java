package com.example.profilestore.model;

import lombok.*;

/**
 * Session lock stamped into a persisted profile by the process that owns write access.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionData {
    private long lastUpdate;
    private String ownerToken;
}
