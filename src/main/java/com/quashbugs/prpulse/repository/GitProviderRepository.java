package com.quashbugs.prpulse.repository;

import com.quashbugs.prpulse.model.GitProvider;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface GitProviderRepository extends MongoRepository<GitProvider, String> {

    // refreshable connections: an oauth refresh token or a github app installation
    @Query("{ 'expiresAt': { '$lt': ?0 }, '$or': [ { 'refreshToken': { '$ne': null } }, { 'installationId': { '$ne': null } } ] }")
    List<GitProvider> findExpiringBefore(Instant cutoff);
}
