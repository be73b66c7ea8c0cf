package com.quashbugs.prpulse.repository;

import com.quashbugs.prpulse.model.EscalationTracking;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface EscalationTrackingRepository extends MongoRepository<EscalationTracking, String> {

    Optional<EscalationTracking> findByScheduleIdAndPullRequestId(String scheduleId, String pullRequestId);

    long deleteByScheduleIdAndPullRequestIdNotIn(String scheduleId, Collection<String> activePullRequestIds);
}
