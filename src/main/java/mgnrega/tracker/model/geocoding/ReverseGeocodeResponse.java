package mgnrega.tracker.model.geocoding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Subset of the Nominatim /reverse?format=json response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReverseGeocodeResponse {

    @JsonProperty("display_name")
    private String displayName;

    private Address address;

    private String error;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        @JsonProperty("state_district")
        private String stateDistrict;
        private String county;
        private String city;
        private String village;
        private String state;
    }
}
