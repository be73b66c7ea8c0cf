package com.quashbugs.prpulse.repository;

import com.quashbugs.prpulse.model.Schedule;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ScheduleRepository extends MongoRepository<Schedule, String> {

    List<Schedule> findByActiveTrue();

    /**
     * Moves lastExecuted forward to {@code at}. Never moves it backwards: the update only matches
     * when the stored value is missing or older.
     *
     * @return number of documents modified (0 or 1)
     */
    @Query("{ '_id': ?0, '$or': [ { 'lastExecuted': null }, { 'lastExecuted': { '$lt': ?1 } } ] }")
    @Update("{ '$set': { 'lastExecuted': ?1, 'updatedAt': ?1 } }")
    long markExecuted(String scheduleId, Instant at);
}
