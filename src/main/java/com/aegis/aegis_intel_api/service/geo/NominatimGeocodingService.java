package com.aegis.aegis_intel_api.service.geo;

import com.aegis.aegis_intel_api.dto.geo.GeoLocation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
public class NominatimGeocodingService implements GeocodingService {

    private static final List<String> ADDRESS_FIELDS =
            List.of("city", "town", "village", "county", "state", "country");
    private static final int MAX_NAME_PARTS = 3;

    private final RestTemplate restTemplate;

    @Value("${aegis.geocoding.url:https://nominatim.openstreetmap.org/reverse}")
    private String reverseUrl;

    @Value("${aegis.geocoding.user-agent:aegis-intel-api/1.0}")
    private String userAgent;

    @Autowired
    public NominatimGeocodingService(@Qualifier("geocodingRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    NominatimGeocodingService(RestTemplate restTemplate, String reverseUrl, String userAgent) {
        this.restTemplate = restTemplate;
        this.reverseUrl = reverseUrl;
        this.userAgent = userAgent;
    }

    @Override
    public Optional<GeoLocation> reverseGeocode(double latitude, double longitude) {
        if (!isValid(latitude, longitude)) {
            log.warn("Ignoring out-of-range coordinates {}, {}", latitude, longitude);
            return Optional.empty();
        }

        String name = lookupName(latitude, longitude);
        if (name == null) {
            name = formatCoordinates(latitude, longitude);
        }
        return Optional.of(GeoLocation.of(latitude, longitude, name));
    }

    private String lookupName(double latitude, double longitude) {
        try {
            String url = UriComponentsBuilder.fromUriString(reverseUrl)
                    .queryParam("lat", latitude)
                    .queryParam("lon", longitude)
                    .queryParam("format", "jsonv2")
                    .toUriString();

            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.USER_AGENT, userAgent);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));

            JsonNode response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
            String name = composeName(response);
            if (name == null) {
                log.warn("Geocoding returned no place for {}, {}", latitude, longitude);
            }
            return name;
        } catch (RestClientException e) {
            log.warn("Geocoding failed for {}, {}: {}", latitude, longitude, e.getMessage());
            return null;
        }
    }

    static String composeName(JsonNode response) {
        if (response == null || response.has("error")) {
            return null;
        }

        JsonNode address = response.path("address");
        List<String> parts = new ArrayList<>();
        for (String field : ADDRESS_FIELDS) {
            String value = address.path(field).asText("");
            if (StringUtils.hasText(value) && !parts.contains(value)) {
                parts.add(value);
            }
            if (parts.size() == MAX_NAME_PARTS) {
                break;
            }
        }
        if (!parts.isEmpty()) {
            return String.join(", ", parts);
        }

        String displayName = response.path("display_name").asText("");
        return StringUtils.hasText(displayName) ? displayName : null;
    }

    static String formatCoordinates(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.4f° %s, %.4f° %s",
                Math.abs(latitude), latitude >= 0 ? "N" : "S",
                Math.abs(longitude), longitude >= 0 ? "E" : "W");
    }

    static boolean isValid(double latitude, double longitude) {
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }
}
