package mgnrega.tracker.controller;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.SyncLog;
import mgnrega.tracker.service.SyncLogNotFoundException;
import mgnrega.tracker.service.SyntheticDataService;
import mgnrega.tracker.util.SyntheticPerformanceFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/api")
@Slf4j
public class SyncController {

    private final SyntheticDataService syntheticDataService;
    private final Executor syncExecutor;

    @Autowired
    public SyncController(SyntheticDataService syntheticDataService,
                          @Qualifier("syncExecutor") Executor syncExecutor) {
        this.syntheticDataService = syntheticDataService;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Runs the synthetic data generator for the current month in the background.
     */
    @PostMapping("/sync-data")
    public ResponseEntity<Map<String, String>> triggerSync() {
        syncExecutor.execute(() -> syntheticDataService.runSync("manual"));
        log.info("Manual data sync accepted");

        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("syncType", "manual");
        body.put("dataSource", SyntheticPerformanceFactory.DATA_SOURCE);
        return new ResponseEntity<>(body, HttpStatus.ACCEPTED);
    }

    @GetMapping("/sync-status")
    public ResponseEntity<SyncLog> getSyncStatus() {
        SyncLog latest = syntheticDataService.latestSyncLog().orElseThrow(SyncLogNotFoundException::new);
        return new ResponseEntity<>(latest, HttpStatus.OK);
    }
}
