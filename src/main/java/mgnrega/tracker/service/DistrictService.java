package mgnrega.tracker.service;

import lombok.RequiredArgsConstructor;
import mgnrega.tracker.config.TrackerProperties;
import mgnrega.tracker.model.District;
import mgnrega.tracker.model.api.StateSummary;
import mgnrega.tracker.repository.DistrictRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reference data lookups over the districts collection.
 */
@Service
@RequiredArgsConstructor
public class DistrictService {

    private final DistrictRepository districtRepository;
    private final MongoTemplate mongoTemplate;
    private final TrackerProperties properties;

    public List<StateSummary> listStates() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("stateCode", "stateName"),
                Aggregation.project("stateCode", "stateName").andExclude("_id"),
                Aggregation.sort(Sort.Direction.ASC, "stateName"));

        List<StateSummary> states = mongoTemplate
                .aggregate(aggregation, District.class, StateSummary.class)
                .getMappedResults();

        if (states.isEmpty()) {
            // Seeding has not happened yet; still offer the supported state
            TrackerProperties.State state = properties.getState();
            return List.of(new StateSummary(state.getCode(), state.getName()));
        }
        return states;
    }

    public List<String> listDistrictNames(String stateCode) {
        if (!StringUtils.hasText(stateCode)) {
            throw new InvalidRequestException("State parameter is required");
        }
        return districtRepository.findByStateCode(stateCode, Sort.by("districtName")).stream()
                .map(District::getDistrictName)
                .collect(Collectors.toList());
    }

    /**
     * Districts of the supported state in insertion order, so matching is deterministic.
     */
    public List<District> districtsForMatching() {
        return districtRepository.findByStateCode(properties.getState().getCode(), Sort.by("id"));
    }
}
