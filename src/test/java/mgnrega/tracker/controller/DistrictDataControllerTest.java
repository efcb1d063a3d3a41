package mgnrega.tracker.controller;

import mgnrega.tracker.model.api.DistrictDataResponse;
import mgnrega.tracker.model.api.StateSummary;
import mgnrega.tracker.service.ApiLogService;
import mgnrega.tracker.service.DistrictDataNotFoundException;
import mgnrega.tracker.service.DistrictDataService;
import mgnrega.tracker.service.DistrictService;
import mgnrega.tracker.service.InvalidRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DistrictDataController.class)
class DistrictDataControllerTest {

    private static final String PUNE = "पुणे (Pune)";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DistrictDataService districtDataService;

    @MockBean
    private DistrictService districtService;

    @MockBean
    private ApiLogService apiLogService;

    @Test
    void testGetDistrictData_Ok() throws Exception {
        DistrictDataResponse response = DistrictDataResponse.builder()
                .district(PUNE)
                .state("महाराष्ट्र (Maharashtra)")
                .dataMonth("2026-09")
                .lastUpdated("1 October 2026")
                .current(DistrictDataResponse.CurrentMetrics.builder().householdsWorked(72000).avgDays(45.0).build())
                .comparison(DistrictDataResponse.Comparison.builder()
                        .lastMonth(new DistrictDataResponse.PeriodChange(72000, 0))
                        .stateAvg(DistrictDataResponse.StateAverageComparison.builder()
                                .value(70000).position("above").build())
                        .build())
                .historical(List.of(new DistrictDataResponse.HistoricalPoint("Sep 2026", 72000)))
                .build();
        when(districtDataService.getDistrictData("MH", PUNE)).thenReturn(response);

        mockMvc.perform(get("/api/district-data").param("state", "MH").param("district", PUNE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.district").value(PUNE))
                .andExpect(jsonPath("$.dataMonth").value("2026-09"))
                .andExpect(jsonPath("$.current.householdsWorked").value(72000))
                .andExpect(jsonPath("$.comparison.stateAvg.position").value("above"))
                .andExpect(jsonPath("$.historical[0].month").value("Sep 2026"));

        verify(apiLogService).record(eq("/api/district-data"), any(), any(),
                eq(Map.of("state", "MH", "district", PUNE)), eq(200), anyLong(), isNull());
    }

    @Test
    void testGetDistrictData_MissingParametersIsAudited() throws Exception {
        when(districtDataService.getDistrictData(isNull(), isNull()))
                .thenThrow(new InvalidRequestException("State and district parameters are required"));

        mockMvc.perform(get("/api/district-data"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("State and district parameters are required"))
                .andExpect(jsonPath("$.message").exists());

        verify(apiLogService).record(eq("/api/district-data"), any(), any(), anyMap(), eq(400), anyLong(),
                eq("State and district parameters are required"));
    }

    @Test
    void testGetDistrictData_NotFound() throws Exception {
        when(districtDataService.getDistrictData("MH", "Atlantis"))
                .thenThrow(new DistrictDataNotFoundException("MH", "Atlantis"));

        mockMvc.perform(get("/api/district-data").param("state", "MH").param("district", "Atlantis"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No data found for this district"))
                .andExpect(jsonPath("$.message")
                        .value("Database initialization might be incomplete or district name is incorrect."));

        verify(apiLogService).record(eq("/api/district-data"), any(), any(), anyMap(), eq(404), anyLong(), any());
    }

    @Test
    void testGetDistrictData_StorageFailure() throws Exception {
        when(districtDataService.getDistrictData(anyString(), anyString()))
                .thenThrow(new IllegalStateException("Timed out waiting for a server"));

        mockMvc.perform(get("/api/district-data").param("state", "MH").param("district", PUNE))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"))
                .andExpect(jsonPath("$.message").value("Timed out waiting for a server"));

        verify(apiLogService).record(eq("/api/district-data"), any(), any(), anyMap(), eq(500), anyLong(),
                eq("Timed out waiting for a server"));
    }

    @Test
    void testGetStates() throws Exception {
        when(districtService.listStates()).thenReturn(List.of(new StateSummary("MH", "महाराष्ट्र (Maharashtra)")));

        mockMvc.perform(get("/api/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stateCode").value("MH"))
                .andExpect(jsonPath("$[0].stateName").value("महाराष्ट्र (Maharashtra)"));

        verifyNoInteractions(apiLogService);
    }

    @Test
    void testGetDistricts() throws Exception {
        when(districtService.listDistrictNames("MH")).thenReturn(List.of("अकोला (Akola)", PUNE));

        mockMvc.perform(get("/api/districts").param("state", "MH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1]").value(PUNE));
    }

    @Test
    void testGetDistricts_StateRequired() throws Exception {
        when(districtService.listDistrictNames(isNull()))
                .thenThrow(new InvalidRequestException("State parameter is required"));

        mockMvc.perform(get("/api/districts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("State parameter is required"));
    }
}
