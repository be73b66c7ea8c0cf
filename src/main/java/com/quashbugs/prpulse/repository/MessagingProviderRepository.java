package com.quashbugs.prpulse.repository;

import com.quashbugs.prpulse.model.MessagingProvider;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface MessagingProviderRepository extends MongoRepository<MessagingProvider, String> {

    List<MessagingProvider> findByExpiresAtBeforeAndRefreshTokenIsNotNull(Instant cutoff);
}
