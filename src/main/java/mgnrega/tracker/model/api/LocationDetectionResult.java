package mgnrega.tracker.model.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationDetectionResult {

    private boolean detected;
    private String state;
    private String district;
    private String detectedDistrictName;
    private String message;

    // Upstream error behind a "not detected" answer; audited, never sent to the caller
    @JsonIgnore
    private String failureReason;

    public static LocationDetectionResult matched(String stateCode, String districtName) {
        return LocationDetectionResult.builder()
                .detected(true)
                .state(stateCode)
                .district(districtName)
                .build();
    }

    public static LocationDetectionResult notDetected(String detectedDistrictName, String message) {
        return LocationDetectionResult.builder()
                .detected(false)
                .detectedDistrictName(detectedDistrictName)
                .message(message)
                .build();
    }
}
