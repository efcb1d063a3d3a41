package mgnrega.tracker.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.service.DistrictDataNotFoundException;
import mgnrega.tracker.service.InvalidRequestException;
import mgnrega.tracker.service.SyncLogNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the {error, message} body the dashboard expects.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidRequestException ex, HttpServletRequest request) {
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        return errorResponse(ex.getMessage(), "Check the query parameters and try again.");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMissingParameter(MissingServletRequestParameterException ex,
                                                      HttpServletRequest request) {
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        return errorResponse("Parameter '" + ex.getParameterName() + "' is required", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        return errorResponse("Invalid value for parameter '" + ex.getName() + "'", ex.getMessage());
    }

    @ExceptionHandler(DistrictDataNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleDistrictDataNotFound(DistrictDataNotFoundException ex, HttpServletRequest request) {
        log.info("No performance data for {}/{}", ex.getStateCode(), ex.getDistrictName());
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        return errorResponse("No data found for this district",
                "Database initialization might be incomplete or district name is incorrect.");
    }

    @ExceptionHandler(SyncLogNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleSyncLogNotFound(SyncLogNotFoundException ex, HttpServletRequest request) {
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        return errorResponse(ex.getMessage(),
                "Data generation runs at startup and daily; POST /api/sync-data to trigger it now.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        ApiAuditInterceptor.recordError(request, ex.getMessage());
        // Framework errors (unknown path, wrong method) keep their own 4xx status
        if (ex instanceof ErrorResponse && ((ErrorResponse) ex).getStatusCode().is4xxClientError()) {
            ErrorResponse frameworkError = (ErrorResponse) ex;
            return ResponseEntity.status(frameworkError.getStatusCode())
                    .body(errorResponse(frameworkError.getBody().getTitle(), ex.getMessage()));
        }
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorResponse("Internal server error", ex.getMessage()));
    }

    private Map<String, Object> errorResponse(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
