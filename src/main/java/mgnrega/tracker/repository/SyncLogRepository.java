package mgnrega.tracker.repository;

import mgnrega.tracker.model.SyncLog;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SyncLogRepository extends MongoRepository<SyncLog, String> {

    Optional<SyncLog> findFirstByOrderByStartedAtDesc();
}
