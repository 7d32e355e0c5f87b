package me.golemcore.map.adapter.outbound.geocoding;

import me.golemcore.map.domain.model.GeocodeMatch;
import me.golemcore.map.infrastructure.config.AutoConfiguration;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.infrastructure.http.FeignClientFactory;
import me.golemcore.map.port.outbound.GeocodingException;
import me.golemcore.map.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ArcGisGeocodingAdapterTest {

    private OkHttpMockEngine engine;
    private ArcGisGeocodingAdapter adapter;

    @BeforeEach
    void setUp() {
        MapAgentProperties properties = new MapAgentProperties();
        properties.getGeocoding().setBaseUrl("http://geocode.test/arcgis/rest/services/World/GeocodeServer");

        engine = new OkHttpMockEngine();
        OkHttpClient okHttpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new ArcGisGeocodingAdapter(new FeignClientFactory(okHttpClient, AutoConfiguration.objectMapper()),
                properties);
        adapter.init();
    }

    // ===== Successful lookups =====

    @Test
    void shouldReturnFirstCandidate() {
        engine.enqueueJson(200, """
                {"spatialReference": {"wkid": 4326},
                 "candidates": [
                   {"address": "1600 Pennsylvania Ave NW, Washington, District of Columbia, 20500",
                    "location": {"x": -77.03655, "y": 38.89768}, "score": 98.5,
                    "attributes": {"Loc_name": "World"}},
                   {"address": "1600 Pennsylvania Ave, Baltimore, Maryland",
                    "location": {"x": -76.63, "y": 39.30}, "score": 80}
                 ]}
                """);

        Optional<GeocodeMatch> match = adapter.findBestMatch("1600 Pennsylvania Avenue, Washington DC");

        assertTrue(match.isPresent());
        assertEquals(38.89768, match.get().latitude());
        assertEquals(-77.03655, match.get().longitude());
        assertEquals(98.5, match.get().score());
        assertEquals(2, match.get().candidateCount());
        assertTrue(match.get().formattedAddress().startsWith("1600 Pennsylvania Ave NW"));
    }

    @Test
    void shouldSendSingleLineQueryWithJsonFormat() {
        engine.enqueueJson(200, "{\"candidates\": []}");

        adapter.findBestMatch("Eiffel Tower, Paris");

        OkHttpMockEngine.RecordedRequest sent = engine.lastRequest();
        assertEquals("GET", sent.method());
        assertEquals("/arcgis/rest/services/World/GeocodeServer/findAddressCandidates", sent.path());
        assertEquals("Eiffel Tower, Paris", sent.queryParameter("SingleLine"));
        assertEquals("json", sent.queryParameter("f"));
        assertEquals("10", sent.queryParameter("maxLocations"));
    }

    @Test
    void shouldReturnEmptyWhenNoCandidates() {
        engine.enqueueJson(200, "{\"spatialReference\": {\"wkid\": 4326}, \"candidates\": []}");

        assertTrue(adapter.findBestMatch("qwertyuiop").isEmpty());
    }

    @Test
    void shouldTreatMissingScoreAsZero() {
        engine.enqueueJson(200, """
                {"candidates": [{"address": "Somewhere", "location": {"x": 1.5, "y": 2.5}}]}
                """);

        GeocodeMatch match = adapter.findBestMatch("somewhere").orElseThrow();

        assertEquals(0.0, match.score());
        assertEquals(2.5, match.latitude());
    }

    // ===== Failures =====

    @Test
    void shouldFailOnHttpError() {
        engine.enqueueJson(500, "{}");

        GeocodingException e = assertThrows(GeocodingException.class, () -> adapter.findBestMatch("Paris"));

        assertEquals("Geocoding service returned HTTP 500", e.getMessage());
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldFailOnNetworkError() {
        engine.enqueueFailure(new SocketTimeoutException("timeout"));

        GeocodingException e = assertThrows(GeocodingException.class, () -> adapter.findBestMatch("Paris"));

        assertTrue(e.getMessage().startsWith("Network error during geocoding"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldFailOnErrorBody() {
        engine.enqueueJson(200, """
                {"error": {"code": 400, "message": "Unable to complete operation.", "details": []}}
                """);

        GeocodingException e = assertThrows(GeocodingException.class, () -> adapter.findBestMatch("Paris"));

        assertEquals("Geocoding service error 400: Unable to complete operation.", e.getMessage());
    }

    @Test
    void shouldFailOnMissingCoordinates() {
        engine.enqueueJson(200, """
                {"candidates": [{"address": "Broken", "location": {"x": 2.35}, "score": 90}]}
                """);

        GeocodingException e = assertThrows(GeocodingException.class, () -> adapter.findBestMatch("Paris"));

        assertEquals("Invalid coordinates received from geocoding service", e.getMessage());
    }

    @Test
    void shouldFailOnMalformedBody() {
        engine.enqueueJson(200, "<html>not json</html>");

        GeocodingException e = assertThrows(GeocodingException.class, () -> adapter.findBestMatch("Paris"));

        assertEquals("Malformed response from geocoding service", e.getMessage());
    }
}
