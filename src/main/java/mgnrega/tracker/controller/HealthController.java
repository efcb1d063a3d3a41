package mgnrega.tracker.controller;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Autowired
    public HealthController(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            body.put("status", "healthy");
            body.put("database", "connected");
            body.put("timestamp", clock.instant().toString());
            return new ResponseEntity<>(body, HttpStatus.OK);
        } catch (RuntimeException e) {
            log.warn("Health check failed: {}", e.getMessage());
            body.put("status", "unhealthy");
            body.put("database", "disconnected");
            body.put("error", e.getMessage());
            return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
        }
    }
}
