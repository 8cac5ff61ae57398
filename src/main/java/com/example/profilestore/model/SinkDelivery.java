package com.example.profilestore.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sink_deliveries")
public class SinkDelivery {
    @Id
    private String id;
    private String ownerId;
    private long version;
    private String payload; // serialized profile document
    private Instant ts;
    private int attempts;
    private String lastError;
    private boolean delivered;
}
