package mgnrega.tracker.util;

import mgnrega.tracker.model.Performance;

import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds placeholder performance rows with bounded pseudo-random values.
 * The figures are synthetic; they do not come from the official MGNREGA data feed.
 */
public final class SyntheticPerformanceFactory {

    public static final String DATA_SOURCE = "Synthetic data generator (not an official feed)";

    private static final int MIN_HOUSEHOLDS = 60_000;
    private static final int MAX_HOUSEHOLDS = 90_000;
    private static final double SC_SHARE = 0.20;
    private static final double ST_SHARE = 0.15;
    private static final int EXPENDITURE_PER_HOUSEHOLD_DAY = 300;

    private SyntheticPerformanceFactory() {
    }

    public static Performance create(String stateCode, String stateName, String districtName,
                                     LocalDate dataMonth, Instant now) {
        ThreadLocalRandom random = ThreadLocalRandom.current();

        long households = random.nextInt(MIN_HOUSEHOLDS, MAX_HOUSEHOLDS);
        long activeWorkers = (long) Math.floor(households * random.nextDouble(0.70, 0.90));
        long womenWorkers = (long) Math.floor(activeWorkers * random.nextDouble(0.55, 0.70));
        double avgDays = MetricMath.round(random.nextDouble(35, 55), 1);
        double avgWage = MetricMath.round(random.nextDouble(285, 335), 2);
        double expenditure = MetricMath.round(
                households * EXPENDITURE_PER_HOUSEHOLD_DAY * random.nextDouble(35, 55), 2);

        return Performance.builder()
                .stateCode(stateCode)
                .stateName(stateName)
                .districtName(districtName)
                .dataMonth(dataMonth)
                .jobCardsIssued((long) Math.floor(households * random.nextDouble(1.10, 1.40)))
                .householdsWorked(households)
                .activeWorkers(activeWorkers)
                .womenWorkers(womenWorkers)
                .scWorkers((long) Math.floor(activeWorkers * SC_SHARE))
                .stWorkers((long) Math.floor(activeWorkers * ST_SHARE))
                .avgDaysProvided(avgDays)
                .totalPersondays(Math.round(activeWorkers * avgDays))
                .avgWage(avgWage)
                .totalExpenditure(expenditure)
                .completedWorks(random.nextInt(800, 1400))
                .ongoingWorks(random.nextInt(300, 700))
                .updatedAt(now)
                .dataSource(DATA_SOURCE)
                .build();
    }
}
