package mgnrega.tracker.service;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.config.TrackerProperties;
import mgnrega.tracker.model.District;
import mgnrega.tracker.model.Performance;
import mgnrega.tracker.model.SyncLog;
import mgnrega.tracker.repository.DistrictRepository;
import mgnrega.tracker.repository.PerformanceRepository;
import mgnrega.tracker.repository.SyncLogRepository;
import mgnrega.tracker.util.ReportingPeriod;
import mgnrega.tracker.util.SyntheticPerformanceFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Fills the performance collection with generated figures for the current data month.
 * <p>
 * There is no integration with the official MGNREGA feed: every row written here is synthetic
 * and labelled as such in its dataSource. Rows are insert-if-absent, so runs are idempotent.
 */
@Service
@Slf4j
public class SyntheticDataService {

    public enum Outcome {
        INSERTED,
        SKIPPED,
        FAILED
    }

    public record GenerationResult(LocalDate dataMonth, int inserted, int skipped, int failed) {
    }

    private final DistrictRepository districtRepository;
    private final PerformanceRepository performanceRepository;
    private final SyncLogRepository syncLogRepository;
    private final TrackerProperties properties;
    private final Clock clock;
    private final Executor generationExecutor;

    @Autowired
    public SyntheticDataService(DistrictRepository districtRepository,
                                PerformanceRepository performanceRepository,
                                SyncLogRepository syncLogRepository,
                                TrackerProperties properties,
                                Clock clock,
                                @Qualifier("generationExecutor") Executor generationExecutor) {
        this.districtRepository = districtRepository;
        this.performanceRepository = performanceRepository;
        this.syncLogRepository = syncLogRepository;
        this.properties = properties;
        this.clock = clock;
        this.generationExecutor = generationExecutor;
    }

    /**
     * Generates a row for every district of the configured state that has none for the current
     * data month. Districts are processed concurrently; one district failing does not affect
     * the others.
     */
    public GenerationResult ensureCurrentMonth() {
        String stateCode = properties.getState().getCode();
        LocalDate dataMonth = ReportingPeriod.currentDataMonth(clock);
        List<District> districts = districtRepository.findByStateCode(stateCode, Sort.by("districtName"));

        log.info("Ensuring {} performance rows for {} districts of {}",
                ReportingPeriod.monthKey(dataMonth), districts.size(), stateCode);

        List<CompletableFuture<Outcome>> futures = districts.stream()
                .map(district -> CompletableFuture
                        .supplyAsync(() -> generateIfMissing(district, dataMonth), generationExecutor)
                        .exceptionally(ex -> {
                            log.error("Data generation failed for district {}: {}",
                                    district.getDistrictName(), ex.getMessage(), ex);
                            return Outcome.FAILED;
                        }))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int inserted = 0;
        int skipped = 0;
        int failed = 0;
        for (CompletableFuture<Outcome> future : futures) {
            Outcome outcome = future.join();
            if (outcome == Outcome.INSERTED) {
                inserted++;
            } else if (outcome == Outcome.SKIPPED) {
                skipped++;
            } else {
                failed++;
            }
        }

        GenerationResult result = new GenerationResult(dataMonth, inserted, skipped, failed);
        log.info("Data generation for {} finished: {} inserted, {} already present, {} failed",
                ReportingPeriod.monthKey(dataMonth), inserted, skipped, failed);
        return result;
    }

    Outcome generateIfMissing(District district, LocalDate dataMonth) {
        if (performanceRepository.existsByStateCodeAndDistrictNameAndDataMonth(
                district.getStateCode(), district.getDistrictName(), dataMonth)) {
            return Outcome.SKIPPED;
        }

        Performance performance = SyntheticPerformanceFactory.create(
                district.getStateCode(), district.getStateName(), district.getDistrictName(),
                dataMonth, clock.instant());
        try {
            performanceRepository.insert(performance);
            return Outcome.INSERTED;
        } catch (DuplicateKeyException e) {
            // Another run inserted the same month concurrently
            log.warn("Performance row for {} {} already exists, skipping",
                    district.getDistrictName(), ReportingPeriod.monthKey(dataMonth));
            return Outcome.SKIPPED;
        }
    }

    /**
     * Runs {@link #ensureCurrentMonth()} and records the run in the sync log.
     * Never throws; failures end up in the returned log entry.
     */
    public SyncLog runSync(String syncType) {
        SyncLog syncLog = SyncLog.builder()
                .syncType(syncType)
                .status(SyncLog.SyncStatus.STARTED)
                .startedAt(clock.instant())
                .build();

        try {
            syncLog = syncLogRepository.save(syncLog);
            GenerationResult result = ensureCurrentMonth();
            syncLog.setRecordsProcessed(result.inserted());
            if (result.failed() > 0) {
                syncLog.setStatus(SyncLog.SyncStatus.FAILED);
                syncLog.setErrorMessage(result.failed() + " district(s) failed during data generation");
            } else {
                syncLog.setStatus(SyncLog.SyncStatus.SUCCESS);
            }
        } catch (RuntimeException e) {
            log.error("{} sync failed: {}", syncType, e.getMessage(), e);
            syncLog.setStatus(SyncLog.SyncStatus.FAILED);
            syncLog.setErrorMessage(e.getMessage());
        }

        syncLog.setCompletedAt(clock.instant());
        try {
            return syncLogRepository.save(syncLog);
        } catch (RuntimeException e) {
            log.error("Could not record {} sync result ({}): {}", syncType, syncLog.getStatus(), e.getMessage(), e);
            return syncLog;
        }
    }

    public Optional<SyncLog> latestSyncLog() {
        return syncLogRepository.findFirstByOrderByStartedAtDesc();
    }
}
