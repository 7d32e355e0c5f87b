package me.golemcore.map.adapter.outbound.geocoding;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.codec.DecodeException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.model.GeocodeMatch;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.infrastructure.http.FeignClientFactory;
import me.golemcore.map.port.outbound.GeocodingException;
import me.golemcore.map.port.outbound.GeocodingPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Geocoding through the public ArcGIS World GeocodeServer.
 *
 * <p>
 * Calls {@code findAddressCandidates} once per lookup and keeps only the
 * first (highest scored) candidate. ArcGIS reports coordinates as
 * {@code location.x} (longitude) and {@code location.y} (latitude), and may
 * answer HTTP 200 with an {@code error} body, which is treated as a failure.
 *
 * @see <a href=
 *      "https://developers.arcgis.com/rest/geocode/api-reference/geocoding-find-address-candidates.htm">findAddressCandidates</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArcGisGeocodingAdapter implements GeocodingPort {

    private final FeignClientFactory feignClientFactory;
    private final MapAgentProperties properties;

    private ArcGisApi arcGisApi;

    @PostConstruct
    public void init() {
        String baseUrl = properties.getGeocoding().getBaseUrl();
        this.arcGisApi = feignClientFactory.create(ArcGisApi.class, baseUrl);
        log.info("[Geocoding] ArcGIS geocoder initialized: {}", baseUrl);
    }

    @Override
    public Optional<GeocodeMatch> findBestMatch(String address) {
        CandidatesResponse response;
        try {
            response = arcGisApi.findAddressCandidates(address, properties.getGeocoding().getMaxLocations());
        } catch (RetryableException e) {
            log.warn("[Geocoding] Network error for '{}': {}", address, e.getMessage());
            throw new GeocodingException("Network error during geocoding: " + e.getMessage(), e);
        } catch (DecodeException e) {
            log.warn("[Geocoding] Malformed response for '{}': {}", address, e.getMessage());
            throw new GeocodingException("Malformed response from geocoding service", e);
        } catch (FeignException e) {
            if (isSuccessStatus(e.status())) {
                // body arrived but could not be read
                log.warn("[Geocoding] Unreadable response for '{}': {}", address, e.getMessage());
                throw new GeocodingException("Malformed response from geocoding service", e);
            }
            log.warn("[Geocoding] HTTP {} for '{}'", e.status(), address);
            throw new GeocodingException("Geocoding service returned HTTP " + e.status(), e);
        }

        if (response == null) {
            throw new GeocodingException("Geocoding service returned an empty body");
        }
        if (response.getError() != null) {
            ServiceError error = response.getError();
            throw new GeocodingException("Geocoding service error " + error.getCode() + ": " + error.getMessage());
        }

        List<Candidate> candidates = response.getCandidates();
        if (candidates == null || candidates.isEmpty()) {
            log.debug("[Geocoding] No candidates for '{}'", address);
            return Optional.empty();
        }

        Candidate best = candidates.get(0);
        Location location = best.getLocation();
        if (location == null || location.getX() == null || location.getY() == null) {
            throw new GeocodingException("Invalid coordinates received from geocoding service");
        }

        double score = best.getScore() != null ? best.getScore() : 0.0;
        log.debug("[Geocoding] '{}' -> {} (lat={}, lon={}, score={})", address, best.getAddress(),
                location.getY(), location.getX(), score);
        return Optional.of(new GeocodeMatch(location.getY(), location.getX(), score, best.getAddress(),
                candidates.size()));
    }

    private static boolean isSuccessStatus(int status) {
        return status >= 200 && status < 300;
    }

    // Feign API interface
    interface ArcGisApi {
        @RequestLine("GET /findAddressCandidates?f=json&maxLocations={maxLocations}&outFields=*&SingleLine={address}")
        CandidatesResponse findAddressCandidates(@Param("address") String address,
                @Param("maxLocations") int maxLocations);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CandidatesResponse {
        private List<Candidate> candidates;
        private ServiceError error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Candidate {
        private String address;
        private Location location;
        private Double score;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Location {
        private Double x;
        private Double y;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ServiceError {
        private Integer code;
        private String message;
    }
}
