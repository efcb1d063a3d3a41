package mgnrega.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One month of programme statistics for one district.
 * Keyed by (stateCode, districtName, dataMonth); rows are written once and never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "performance")
public class Performance {
    @Id
    private String id;
    private String stateCode;
    private String stateName;
    private String districtName;
    private LocalDate dataMonth; // Always the first day of the month

    // Job cards and workers
    private long jobCardsIssued;
    private long householdsWorked;
    private long activeWorkers;
    private long womenWorkers;
    private long scWorkers;
    private long stWorkers;

    // Employment
    private double avgDaysProvided;
    private long totalPersondays;

    // Financials
    private double avgWage;
    private double totalExpenditure;

    // Works
    private long completedWorks;
    private long ongoingWorks;

    private Instant updatedAt;
    private String dataSource;
}
