package mgnrega.tracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.ApiLog;
import mgnrega.tracker.repository.ApiLogRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class ApiLogService {

    private final ApiLogRepository apiLogRepository;
    private final Clock clock;

    /**
     * Appends one audit row. A storage failure is logged and does not reach the caller.
     */
    public void record(String endpoint, String ipAddress, String userAgent, Map<String, String> requestParams,
                       int responseStatus, long responseTimeMs, String errorMessage) {
        ApiLog entry = ApiLog.builder()
                .endpoint(endpoint)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .requestParams(requestParams)
                .responseStatus(responseStatus)
                .responseTimeMs(responseTimeMs)
                .errorMessage(errorMessage)
                .createdAt(clock.instant())
                .build();
        try {
            apiLogRepository.save(entry);
        } catch (RuntimeException e) {
            log.error("Could not write API log for {} (status {}): {}", endpoint, responseStatus, e.getMessage(), e);
        }
    }
}
