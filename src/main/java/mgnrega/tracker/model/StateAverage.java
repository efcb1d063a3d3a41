package mgnrega.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result row of the per-state, per-month $group aggregation over performance.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateAverage {
    private double avgHouseholds;
    private double avgDays;
    private double avgWage;
    private int districtCount;
}
