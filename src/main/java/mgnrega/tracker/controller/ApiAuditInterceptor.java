package mgnrega.tracker.controller;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import mgnrega.tracker.service.ApiLogService;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes an api_logs row for every request it is mapped to, after the response status is final.
 * Handlers that answer successfully despite an upstream problem can attach the reason with
 * {@link #recordError(HttpServletRequest, String)}.
 */
@Component
@RequiredArgsConstructor
public class ApiAuditInterceptor implements HandlerInterceptor {

    static final String START_ATTRIBUTE = ApiAuditInterceptor.class.getName() + ".start";
    static final String ERROR_ATTRIBUTE = ApiAuditInterceptor.class.getName() + ".error";

    private final ApiLogService apiLogService;

    public static void recordError(HttpServletRequest request, String message) {
        request.setAttribute(ERROR_ATTRIBUTE, message);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        long elapsed = start instanceof Long ? System.currentTimeMillis() - (Long) start : 0;

        String error = ex != null ? ex.getMessage() : (String) request.getAttribute(ERROR_ATTRIBUTE);

        apiLogService.record(
                request.getRequestURI(),
                request.getRemoteAddr(),
                request.getHeader(HttpHeaders.USER_AGENT),
                queryParams(request),
                response.getStatus(),
                elapsed,
                error);
    }

    private Map<String, String> queryParams(HttpServletRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) ->
                params.put(name, values.length > 0 ? values[0] : null));
        return params;
    }
}
