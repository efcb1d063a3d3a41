package mgnrega.tracker.sync;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.SyncLog;
import mgnrega.tracker.service.SyntheticDataService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ScheduledTasks {

    private final SyntheticDataService syntheticDataService;

    @Autowired
    public ScheduledTasks(SyntheticDataService syntheticDataService) {
        this.syntheticDataService = syntheticDataService;
    }

    // Daily; only inserts rows that are missing for the current data month
    @Scheduled(cron = "${mgnrega.sync.cron:0 0 2 * * *}", zone = "${mgnrega.zone:Asia/Kolkata}")
    public void scheduleDataSync() {
        log.info("Scheduled data sync triggered");
        SyncLog result = syntheticDataService.runSync("scheduled");
        log.info("Scheduled data sync finished with status {} ({} rows)", result.getStatus(), result.getRecordsProcessed());
    }
}
