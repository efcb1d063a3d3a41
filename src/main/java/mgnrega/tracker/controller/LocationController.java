package mgnrega.tracker.controller;

import jakarta.servlet.http.HttpServletRequest;
import mgnrega.tracker.model.api.LocationDetectionResult;
import mgnrega.tracker.service.LocationDetectionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class LocationController {

    private final LocationDetectionService locationDetectionService;

    @Autowired
    public LocationController(LocationDetectionService locationDetectionService) {
        this.locationDetectionService = locationDetectionService;
    }

    /**
     * Always 200 once the coordinates are valid; "detected" tells the caller whether a district was found.
     */
    @GetMapping("/detect-location")
    public ResponseEntity<LocationDetectionResult> detectLocation(
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng,
            HttpServletRequest request) {
        LocationDetectionResult result = locationDetectionService.detectLocation(lat, lng);
        if (result.getFailureReason() != null) {
            ApiAuditInterceptor.recordError(request, result.getFailureReason());
        }
        return new ResponseEntity<>(result, HttpStatus.OK);
    }
}
