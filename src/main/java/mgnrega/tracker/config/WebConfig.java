package mgnrega.tracker.config;

import mgnrega.tracker.controller.ApiAuditInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ApiAuditInterceptor apiAuditInterceptor;

    @Autowired
    public WebConfig(ApiAuditInterceptor apiAuditInterceptor) {
        this.apiAuditInterceptor = apiAuditInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Audited endpoints: metrics and location detection
        registry.addInterceptor(apiAuditInterceptor)
                .addPathPatterns("/api/district-data", "/api/detect-location");
    }
}
