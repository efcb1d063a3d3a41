package mgnrega.tracker.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GeocodingConfig {

    @Bean
    public RestTemplate geocodingRestTemplate(RestTemplateBuilder builder, TrackerProperties properties) {
        TrackerProperties.Geocoding geocoding = properties.getGeocoding();
        // Nominatim's usage policy requires an identifying User-Agent
        return builder
                .rootUri(geocoding.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, geocoding.getUserAgent())
                .setConnectTimeout(geocoding.getTimeout())
                .setReadTimeout(geocoding.getTimeout())
                .build();
    }
}
