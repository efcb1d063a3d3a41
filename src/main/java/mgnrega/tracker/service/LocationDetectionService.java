package mgnrega.tracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.District;
import mgnrega.tracker.model.api.LocationDetectionResult;
import mgnrega.tracker.model.geocoding.ReverseGeocodeResponse;
import mgnrega.tracker.util.DistrictNameMatcher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves coordinates to one of the stored districts.
 * Geocoding problems never surface as errors; the caller gets detected=false and picks manually.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LocationDetectionService {

    static final String SERVICE_UNAVAILABLE_MESSAGE = "Location service temporarily unavailable. Please select manually.";
    static final String NO_REGION_NAME = "External Geocoding Failure";
    static final String NO_REGION_MESSAGE = "External geocoding failed to identify the region name.";

    private static final double MIN_VALID_LAT = -90;
    private static final double MAX_VALID_LAT = 90;
    private static final double MIN_VALID_LON = -180;
    private static final double MAX_VALID_LON = 180;

    private final GeocodingClient geocodingClient;
    private final DistrictService districtService;

    public LocationDetectionResult detectLocation(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            throw new InvalidRequestException("Latitude and longitude parameters are required");
        }
        if (Double.isNaN(latitude) || Double.isNaN(longitude)
                || latitude < MIN_VALID_LAT || latitude > MAX_VALID_LAT
                || longitude < MIN_VALID_LON || longitude > MAX_VALID_LON) {
            throw new InvalidRequestException("Latitude must be within [-90, 90] and longitude within [-180, 180]");
        }

        ReverseGeocodeResponse response;
        try {
            response = geocodingClient.reverse(latitude, longitude);
        } catch (RuntimeException e) {
            log.warn("Reverse geocoding failed for {},{}: {}", latitude, longitude, e.getMessage());
            return unavailable(e);
        }

        String placeName = candidateName(response.getAddress());
        if (placeName == null) {
            log.info("Geocoder returned no district-level name for {},{}", latitude, longitude);
            return LocationDetectionResult.notDetected(NO_REGION_NAME, NO_REGION_MESSAGE);
        }

        List<District> districts;
        try {
            districts = districtService.districtsForMatching();
        } catch (RuntimeException e) {
            log.warn("Could not load districts to match '{}': {}", placeName, e.getMessage());
            return unavailable(e);
        }
        return DistrictNameMatcher.findMatch(placeName, districts)
                .map(district -> {
                    log.debug("Place '{}' matched district {}", placeName, district.getDistrictName());
                    return LocationDetectionResult.matched(district.getStateCode(), district.getDistrictName());
                })
                .orElseGet(() -> LocationDetectionResult.notDetected(placeName,
                        "Location detected but could not map '" + placeName + "' to a known district."));
    }

    private LocationDetectionResult unavailable(RuntimeException cause) {
        LocationDetectionResult result = LocationDetectionResult.notDetected(null, SERVICE_UNAVAILABLE_MESSAGE);
        result.setFailureReason(cause.getMessage());
        return result;
    }

    /**
     * Picks the most district-like name: state_district, then county, city and village.
     */
    static String candidateName(ReverseGeocodeResponse.Address address) {
        if (address == null) {
            return null;
        }
        return Stream.of(address.getStateDistrict(), address.getCounty(), address.getCity(), address.getVillage())
                .filter(StringUtils::hasText)
                .findFirst()
                .orElse(null);
    }
}
