package mgnrega.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Record of one data generation run, whether triggered at startup, by the cron job or manually.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "sync_logs")
public class SyncLog {
    @Id
    private String id;
    private String syncType;
    private SyncStatus status;
    private int recordsProcessed;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public enum SyncStatus {
        STARTED,
        SUCCESS,
        FAILED
    }
}
