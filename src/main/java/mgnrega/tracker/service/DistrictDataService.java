package mgnrega.tracker.service;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.Performance;
import mgnrega.tracker.model.StateAverage;
import mgnrega.tracker.model.api.DistrictDataResponse;
import mgnrega.tracker.model.api.DistrictDataResponse.Comparison;
import mgnrega.tracker.model.api.DistrictDataResponse.CurrentMetrics;
import mgnrega.tracker.model.api.DistrictDataResponse.HistoricalPoint;
import mgnrega.tracker.model.api.DistrictDataResponse.PeriodChange;
import mgnrega.tracker.model.api.DistrictDataResponse.StateAverageComparison;
import mgnrega.tracker.repository.PerformanceRepository;
import mgnrega.tracker.util.MetricMath;
import mgnrega.tracker.util.ReportingPeriod;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.TypedAggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the district dashboard payload.
 * <p>
 * The latest stored month is compared with the previous month, the same month a year earlier
 * and the average of all districts of the state for that month. A comparison row that does not
 * exist is replaced by the current row, which yields a change of zero.
 */
@Service
@Slf4j
public class DistrictDataService {

    private final PerformanceRepository performanceRepository;
    private final MongoTemplate mongoTemplate;
    private final DateTimeFormatter lastUpdatedFormat;

    @Autowired
    public DistrictDataService(PerformanceRepository performanceRepository, MongoTemplate mongoTemplate, Clock clock) {
        this.performanceRepository = performanceRepository;
        this.mongoTemplate = mongoTemplate;
        this.lastUpdatedFormat = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH).withZone(clock.getZone());
    }

    public DistrictDataResponse getDistrictData(String stateCode, String districtName) {
        if (!StringUtils.hasText(stateCode) || !StringUtils.hasText(districtName)) {
            throw new InvalidRequestException("State and district parameters are required");
        }

        Performance current = performanceRepository
                .findFirstByStateCodeAndDistrictNameOrderByDataMonthDesc(stateCode, districtName)
                .orElseThrow(() -> new DistrictDataNotFoundException(stateCode, districtName));

        LocalDate dataMonth = current.getDataMonth();
        Optional<Performance> lastMonth = performanceRepository.findByStateCodeAndDistrictNameAndDataMonth(
                stateCode, districtName, ReportingPeriod.previousMonth(dataMonth));
        Optional<Performance> lastYear = performanceRepository.findByStateCodeAndDistrictNameAndDataMonth(
                stateCode, districtName, ReportingPeriod.sameMonthLastYear(dataMonth));

        StateAverage stateAverage = findStateAverage(stateCode, dataMonth)
                .orElseGet(() -> new StateAverage(current.getHouseholdsWorked(),
                        current.getAvgDaysProvided(), current.getAvgWage(), 1));

        log.debug("District data for {}/{} month={} lastMonth={} lastYear={} stateDistricts={}",
                stateCode, districtName, dataMonth, lastMonth.isPresent(), lastYear.isPresent(),
                stateAverage.getDistrictCount());

        return DistrictDataResponse.builder()
                .district(districtName)
                .state(StringUtils.hasText(current.getStateName()) ? current.getStateName() : stateCode)
                .dataMonth(ReportingPeriod.monthKey(dataMonth))
                .lastUpdated(current.getUpdatedAt() != null ? lastUpdatedFormat.format(current.getUpdatedAt()) : null)
                .dataSource(current.getDataSource())
                .current(currentMetrics(current))
                .comparison(Comparison.builder()
                        .lastMonth(periodChange(current, lastMonth))
                        .lastYear(periodChange(current, lastYear))
                        .stateAvg(stateComparison(current, stateAverage))
                        .build())
                .historical(historical(stateCode, districtName))
                .build();
    }

    /**
     * Mean households worked, days provided and wage over every district of the state that has
     * a row for the given month.
     */
    public Optional<StateAverage> findStateAverage(String stateCode, LocalDate dataMonth) {
        TypedAggregation<Performance> aggregation = Aggregation.newAggregation(Performance.class,
                Aggregation.match(Criteria.where("stateCode").is(stateCode).and("dataMonth").is(dataMonth)),
                Aggregation.group("stateCode")
                        .avg("householdsWorked").as("avgHouseholds")
                        .avg("avgDaysProvided").as("avgDays")
                        .avg("avgWage").as("avgWage")
                        .count().as("districtCount"));

        return Optional.ofNullable(mongoTemplate.aggregate(aggregation, StateAverage.class).getUniqueMappedResult());
    }

    private CurrentMetrics currentMetrics(Performance current) {
        return CurrentMetrics.builder()
                .householdsWorked(current.getHouseholdsWorked())
                .activeWorkers(current.getActiveWorkers())
                .womenWorkers(current.getWomenWorkers())
                .avgDays(MetricMath.round(current.getAvgDaysProvided(), 1))
                .avgWage(MetricMath.round(current.getAvgWage(), 2))
                .totalExpenditure(MetricMath.round(current.getTotalExpenditure(), 2))
                .completedWorks(current.getCompletedWorks())
                .ongoingWorks(current.getOngoingWorks())
                .build();
    }

    private PeriodChange periodChange(Performance current, Optional<Performance> previous) {
        long households = current.getHouseholdsWorked();
        return previous
                .map(p -> new PeriodChange(p.getHouseholdsWorked(),
                        MetricMath.round(MetricMath.percentChange(households, p.getHouseholdsWorked()), 2)))
                .orElseGet(() -> new PeriodChange(households, 0));
    }

    private StateAverageComparison stateComparison(Performance current, StateAverage average) {
        return StateAverageComparison.builder()
                .value(Math.round(average.getAvgHouseholds()))
                .avgDays(MetricMath.round(average.getAvgDays(), 1))
                .avgWage(MetricMath.round(average.getAvgWage(), 2))
                .position(current.getHouseholdsWorked() > average.getAvgHouseholds() ? "above" : "below")
                .build();
    }

    private List<HistoricalPoint> historical(String stateCode, String districtName) {
        List<Performance> recent = new ArrayList<>(performanceRepository
                .findTop12ByStateCodeAndDistrictNameOrderByDataMonthDesc(stateCode, districtName));
        Collections.reverse(recent);
        return recent.stream()
                .map(p -> new HistoricalPoint(ReportingPeriod.monthLabel(p.getDataMonth()), p.getHouseholdsWorked()))
                .collect(Collectors.toList());
    }
}
