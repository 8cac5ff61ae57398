package com.example.profilestore.repo;

import com.example.profilestore.model.SinkDelivery;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SinkDeliveryRepo extends MongoRepository<SinkDelivery, String> {
    List<SinkDelivery> findTop50ByDeliveredFalseAndAttemptsLessThanOrderByTsAsc(int maxAttempts);
    long countByDeliveredFalse();
}
