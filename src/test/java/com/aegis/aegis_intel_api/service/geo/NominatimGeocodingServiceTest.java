package com.aegis.aegis_intel_api.service.geo;

import com.aegis.aegis_intel_api.dto.geo.GeoLocation;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NominatimGeocodingServiceTest {

    private static WireMockServer wireMockServer;

    private NominatimGeocodingService service;

    @BeforeAll
    static void startWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
    }

    @AfterAll
    static void stopWireMock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    @BeforeEach
    void setUp() {
        wireMockServer.resetAll();
        service = new NominatimGeocodingService(new RestTemplate(),
                wireMockServer.baseUrl() + "/reverse", "aegis-test/1.0");
    }

    private void stubReverse(String body) {
        wireMockServer.stubFor(get(urlPathEqualTo("/reverse"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Test
    void reverseGeocode_ComposesDistinctAddressParts() {
        stubReverse("""
                {"display_name":"Tour Eiffel, Paris, France",
                 "address":{"city":"Paris","county":"Paris","state":"Île-de-France","country":"France"}}
                """);

        GeoLocation location = service.reverseGeocode(48.8584, 2.2945).orElseThrow();

        assertEquals("Paris, Île-de-France, France", location.locationName());
        assertEquals("https://www.google.com/maps?q=48.8584,2.2945", location.mapsLink());
        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/reverse"))
                .withQueryParam("format", equalTo("jsonv2"))
                .withQueryParam("lat", equalTo("48.8584"))
                .withHeader("User-Agent", equalTo("aegis-test/1.0")));
    }

    @Test
    void reverseGeocode_FallsBackToDisplayName() {
        stubReverse("{\"display_name\":\"Somewhere at sea\",\"address\":{}}");

        assertEquals("Somewhere at sea", service.reverseGeocode(10.0, -30.0).orElseThrow().locationName());
    }

    @Test
    void reverseGeocode_ErrorPayloadFallsBackToCoordinates() {
        stubReverse("{\"error\":\"Unable to geocode\"}");

        GeoLocation location = service.reverseGeocode(-33.8688, 151.2093).orElseThrow();

        assertEquals("33.8688° S, 151.2093° E", location.locationName());
    }

    @Test
    void reverseGeocode_ServerFailureFallsBackToCoordinates() {
        wireMockServer.stubFor(get(urlPathEqualTo("/reverse")).willReturn(aResponse().withStatus(503)));

        GeoLocation location = service.reverseGeocode(40.7128, -74.006).orElseThrow();

        assertEquals("40.7128° N, 74.0060° W", location.locationName());
        assertEquals(40.7128, location.latitude());
    }

    @Test
    void reverseGeocode_RejectsOutOfRangeCoordinates() {
        assertEquals(Optional.empty(), service.reverseGeocode(91.0, 0.0));
        assertEquals(Optional.empty(), service.reverseGeocode(0.0, -180.5));
        assertEquals(Optional.empty(), service.reverseGeocode(Double.NaN, 0.0));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }
}
