package me.golemcore.map.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.component.ToolComponent;
import me.golemcore.map.domain.model.GeocodeMatch;
import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.model.ToolFailureKind;
import me.golemcore.map.domain.model.ToolResult;
import me.golemcore.map.infrastructure.config.MapAgentProperties;
import me.golemcore.map.port.outbound.GeocodingException;
import me.golemcore.map.port.outbound.GeocodingPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves an address with the geocoder and moves the map there.
 *
 * <p>
 * On a match the center moves to the candidate and the zoom is set to
 * {@code map.geocoding.result-zoom}. On any geocoder failure, including no
 * match, the map is left untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeocodeAddressTool implements ToolComponent {

    private final GeocodingPort geocodingPort;
    private final MapAgentProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(MapToolNames.GEOCODE_ADDRESS)
                .description("Convert an address or place name to coordinates and navigate the map there")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                MapToolNames.PARAM_ADDRESS, Map.of(
                                        "type", "string",
                                        "description",
                                        "Address or place name (e.g., '1600 Pennsylvania Ave, Washington DC', 'Louvre Museum')")),
                        "required", List.of(MapToolNames.PARAM_ADDRESS)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(MapState mapState, Map<String, Object> parameters) {
        String address = ((String) parameters.get(MapToolNames.PARAM_ADDRESS)).trim();
        return CompletableFuture.supplyAsync(() -> geocode(mapState, address));
    }

    private ToolResult geocode(MapState mapState, String address) {
        Optional<GeocodeMatch> match;
        try {
            match = geocodingPort.findBestMatch(address);
        } catch (GeocodingException e) {
            log.warn("[Tools] Geocoding failed for '{}': {}", address, e.getMessage());
            return ToolResult.failure(ToolFailureKind.EXTERNAL_SERVICE,
                    "Geocoding failed for '" + address + "': " + e.getMessage());
        }

        if (match.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.EXTERNAL_SERVICE, "No location found for address: " + address);
        }

        GeocodeMatch best = match.get();
        int zoom = properties.getGeocoding().getResultZoom();
        mapState.moveTo(best.longitude(), best.latitude());
        mapState.zoomTo(zoom);

        String place = best.formattedAddress() != null && !best.formattedAddress().isBlank()
                ? best.formattedAddress()
                : best.latitude() + ", " + best.longitude();
        String output = String.format("Geocoded '%s' and navigated to: %s (confidence: %.0f%%)",
                address, place, best.score());

        Map<String, Object> coordinates = new LinkedHashMap<>();
        coordinates.put(MapToolNames.PARAM_LATITUDE, best.latitude());
        coordinates.put(MapToolNames.PARAM_LONGITUDE, best.longitude());
        coordinates.put("confidence", best.score());
        coordinates.put("formatted_address", best.formattedAddress());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("coordinates", coordinates);
        data.put("candidates_count", best.candidateCount());
        data.put("zoom", zoom);
        return ToolResult.success(output, data);
    }
}
