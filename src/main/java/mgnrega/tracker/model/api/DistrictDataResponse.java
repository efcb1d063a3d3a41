package mgnrega.tracker.model.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of GET /api/district-data: current metrics for a district plus how they compare
 * with the previous month, the same month last year and the state average.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DistrictDataResponse {

    private String district;
    private String state;
    private String dataMonth;   // yyyy-MM
    private String lastUpdated;
    private String dataSource;
    private CurrentMetrics current;
    private Comparison comparison;
    private List<HistoricalPoint> historical;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrentMetrics {
        private long householdsWorked;
        private long activeWorkers;
        private long womenWorkers;
        private double avgDays;
        private double avgWage;
        private double totalExpenditure;
        private long completedWorks;
        private long ongoingWorks;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Comparison {
        private PeriodChange lastMonth;
        private PeriodChange lastYear;
        private StateAverageComparison stateAvg;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeriodChange {
        private long previousValue;
        private double change; // percent
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StateAverageComparison {
        private long value;
        private double avgDays;
        private double avgWage;
        private String position; // "above" | "below"
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoricalPoint {
        private String month;
        private long value;
    }
}
