package mgnrega.tracker.service;

import mgnrega.tracker.config.TrackerProperties;
import mgnrega.tracker.model.District;
import mgnrega.tracker.model.Performance;
import mgnrega.tracker.model.SyncLog;
import mgnrega.tracker.repository.DistrictRepository;
import mgnrega.tracker.repository.PerformanceRepository;
import mgnrega.tracker.repository.SyncLogRepository;
import mgnrega.tracker.util.SyntheticPerformanceFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyntheticDataServiceTest {

    private static final LocalDate SEPTEMBER = LocalDate.of(2026, 9, 1);
    private static final String PUNE = "पुणे (Pune)";
    private static final String THANE = "ठाणे (Thane)";

    @Mock
    private DistrictRepository districtRepository;

    @Mock
    private PerformanceRepository performanceRepository;

    @Mock
    private SyncLogRepository syncLogRepository;

    private SyntheticDataService syntheticDataService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T04:00:00Z"), ZoneId.of("Asia/Kolkata"));
        // Direct executor keeps the per-district tasks on the test thread
        syntheticDataService = new SyntheticDataService(districtRepository, performanceRepository,
                syncLogRepository, new TrackerProperties(), clock, Runnable::run);
    }

    @Test
    void testEnsureCurrentMonth_InsertsOnlyMissingRows() {
        // Given
        givenDistricts(PUNE, THANE);
        when(performanceRepository.existsByStateCodeAndDistrictNameAndDataMonth("MH", PUNE, SEPTEMBER)).thenReturn(true);
        when(performanceRepository.existsByStateCodeAndDistrictNameAndDataMonth("MH", THANE, SEPTEMBER)).thenReturn(false);

        // When
        SyntheticDataService.GenerationResult result = syntheticDataService.ensureCurrentMonth();

        // Then
        assertEquals(SEPTEMBER, result.dataMonth());
        assertEquals(1, result.inserted());
        assertEquals(1, result.skipped());
        assertEquals(0, result.failed());

        ArgumentCaptor<Performance> captor = ArgumentCaptor.forClass(Performance.class);
        verify(performanceRepository).insert(captor.capture());
        Performance inserted = captor.getValue();
        assertEquals(THANE, inserted.getDistrictName());
        assertEquals("MH", inserted.getStateCode());
        assertEquals("महाराष्ट्र (Maharashtra)", inserted.getStateName());
        assertEquals(SEPTEMBER, inserted.getDataMonth());
        assertEquals(SyntheticPerformanceFactory.DATA_SOURCE, inserted.getDataSource());
    }

    @Test
    void testEnsureCurrentMonth_SecondRunInsertsNothing() {
        givenDistricts(PUNE, THANE);
        when(performanceRepository.existsByStateCodeAndDistrictNameAndDataMonth(eq("MH"), anyString(), eq(SEPTEMBER)))
                .thenReturn(true);

        SyntheticDataService.GenerationResult result = syntheticDataService.ensureCurrentMonth();

        assertEquals(0, result.inserted());
        assertEquals(2, result.skipped());
        verify(performanceRepository, never()).insert(any(Performance.class));
    }

    @Test
    void testEnsureCurrentMonth_DuplicateKeyIsSkippedNotFailed() {
        givenDistricts(PUNE);
        when(performanceRepository.insert(any(Performance.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error"));

        SyntheticDataService.GenerationResult result = syntheticDataService.ensureCurrentMonth();

        assertEquals(0, result.inserted());
        assertEquals(1, result.skipped());
        assertEquals(0, result.failed());
    }

    @Test
    void testEnsureCurrentMonth_FailureInOneDistrictDoesNotStopOthers() {
        givenDistricts(PUNE, THANE);
        when(performanceRepository.insert(any(Performance.class))).thenAnswer(invocation -> {
            Performance performance = invocation.getArgument(0);
            if (PUNE.equals(performance.getDistrictName())) {
                throw new IllegalStateException("write concern error");
            }
            return performance;
        });

        SyntheticDataService.GenerationResult result = syntheticDataService.ensureCurrentMonth();

        assertEquals(1, result.inserted());
        assertEquals(1, result.failed());
        verify(performanceRepository, times(2)).insert(any(Performance.class));
    }

    @Test
    void testRunSync_RecordsSuccess() {
        givenDistricts(PUNE, THANE);
        when(syncLogRepository.save(any(SyncLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SyncLog syncLog = syntheticDataService.runSync("manual");

        assertEquals("manual", syncLog.getSyncType());
        assertEquals(SyncLog.SyncStatus.SUCCESS, syncLog.getStatus());
        assertEquals(2, syncLog.getRecordsProcessed());
        assertNull(syncLog.getErrorMessage());
        assertNotNull(syncLog.getStartedAt());
        assertNotNull(syncLog.getCompletedAt());
        verify(syncLogRepository, times(2)).save(any(SyncLog.class));
    }

    @Test
    void testRunSync_RecordsFailure() {
        when(syncLogRepository.save(any(SyncLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(districtRepository.findByStateCode("MH", Sort.by("districtName")))
                .thenThrow(new IllegalStateException("connection refused"));

        SyncLog syncLog = syntheticDataService.runSync("scheduled");

        assertEquals(SyncLog.SyncStatus.FAILED, syncLog.getStatus());
        assertEquals("connection refused", syncLog.getErrorMessage());
        assertEquals(0, syncLog.getRecordsProcessed());
    }

    @Test
    void testRunSync_SyncLogStoreDownDoesNotThrow() {
        when(syncLogRepository.save(any(SyncLog.class)))
                .thenThrow(new DataAccessResourceFailureException("Timed out waiting for a server"));

        SyncLog syncLog = syntheticDataService.runSync("manual");

        assertEquals(SyncLog.SyncStatus.FAILED, syncLog.getStatus());
        assertEquals("Timed out waiting for a server", syncLog.getErrorMessage());
        assertNotNull(syncLog.getCompletedAt());
        verifyNoInteractions(districtRepository, performanceRepository);
    }

    @Test
    void testLatestSyncLog() {
        SyncLog latest = SyncLog.builder().syncType("startup").status(SyncLog.SyncStatus.SUCCESS).build();
        when(syncLogRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.of(latest));

        assertEquals(Optional.of(latest), syntheticDataService.latestSyncLog());
    }

    private void givenDistricts(String... names) {
        List<District> districts = new java.util.ArrayList<>();
        for (String name : names) {
            districts.add(District.builder()
                    .stateCode("MH")
                    .stateName("महाराष्ट्र (Maharashtra)")
                    .districtName(name)
                    .build());
        }
        when(districtRepository.findByStateCode("MH", Sort.by("districtName"))).thenReturn(districts);
    }
}
