package com.quashbugs.prpulse.repository;

import com.quashbugs.prpulse.model.ExecutionLog;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

// append-only: the engine only ever calls save() with a fresh document
@Repository
public interface ExecutionLogRepository extends MongoRepository<ExecutionLog, String> {
}
