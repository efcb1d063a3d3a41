package mgnrega.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "api_logs")
public class ApiLog {
    @Id
    private String id;
    private String endpoint;
    private String ipAddress;
    private String userAgent;
    private Map<String, String> requestParams;
    private int responseStatus;
    private long responseTimeMs;
    private String errorMessage;
    private Instant createdAt;
}
