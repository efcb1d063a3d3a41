package mgnrega.tracker.controller;

import mgnrega.tracker.model.api.DistrictDataResponse;
import mgnrega.tracker.model.api.StateSummary;
import mgnrega.tracker.service.DistrictDataService;
import mgnrega.tracker.service.DistrictService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class DistrictDataController {

    private final DistrictDataService districtDataService;
    private final DistrictService districtService;

    @Autowired
    public DistrictDataController(DistrictDataService districtDataService, DistrictService districtService) {
        this.districtDataService = districtDataService;
        this.districtService = districtService;
    }

    /**
     * GET /api/district-data?state=MH&district=पुणे (Pune)
     */
    @GetMapping("/district-data")
    public ResponseEntity<DistrictDataResponse> getDistrictData(
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String district) {
        DistrictDataResponse response = districtDataService.getDistrictData(state, district);
        return new ResponseEntity<>(response, HttpStatus.OK);
    }

    @GetMapping("/states")
    public ResponseEntity<List<StateSummary>> getStates() {
        return new ResponseEntity<>(districtService.listStates(), HttpStatus.OK);
    }

    @GetMapping("/districts")
    public ResponseEntity<List<String>> getDistricts(@RequestParam(required = false) String state) {
        return new ResponseEntity<>(districtService.listDistrictNames(state), HttpStatus.OK);
    }
}
