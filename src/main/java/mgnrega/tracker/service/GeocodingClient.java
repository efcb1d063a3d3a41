package mgnrega.tracker.service;

import lombok.extern.slf4j.Slf4j;
import mgnrega.tracker.model.geocoding.ReverseGeocodeResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Thin client over the OpenStreetMap Nominatim reverse geocoding API.
 *
 * The RestTemplate carries the base URL, the User-Agent required by Nominatim's usage policy
 * and the connect/read timeouts. No retries: a failed lookup is reported to the caller at once.
 */
@Service
@Slf4j
public class GeocodingClient {

    private final RestTemplate restTemplate;

    @Autowired
    public GeocodingClient(@Qualifier("geocodingRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * @return the parsed response, never null
     * @throws GeocodingException when the service is unreachable, times out or reports an error
     */
    public ReverseGeocodeResponse reverse(double latitude, double longitude) {
        String uri = UriComponentsBuilder.fromPath("/reverse")
                .queryParam("format", "json")
                .queryParam("lat", latitude)
                .queryParam("lon", longitude)
                .toUriString();

        log.debug("Reverse geocoding {}", uri);
        ReverseGeocodeResponse response;
        try {
            response = restTemplate.getForObject(uri, ReverseGeocodeResponse.class);
        } catch (RestClientException e) {
            throw new GeocodingException("Reverse geocoding request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new GeocodingException("Reverse geocoding returned an empty body");
        }
        if (response.getError() != null) {
            throw new GeocodingException("Reverse geocoding error: " + response.getError());
        }
        return response;
    }
}
