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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.map.domain.component.ToolComponent;
import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Moves the map center to a latitude/longitude pair.
 *
 * <p>
 * The advertised ranges are not re-checked here; whatever the model sends is
 * applied.
 */
@Component
@Slf4j
public class NavigateToLocationTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(MapToolNames.NAVIGATE_TO_LOCATION)
                .description("Navigate the map to a specific latitude and longitude")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                MapToolNames.PARAM_LATITUDE, Map.of(
                                        "type", "number",
                                        "description", "Latitude coordinate (-90 to 90)"),
                                MapToolNames.PARAM_LONGITUDE, Map.of(
                                        "type", "number",
                                        "description", "Longitude coordinate (-180 to 180)")),
                        "required", List.of(MapToolNames.PARAM_LATITUDE, MapToolNames.PARAM_LONGITUDE)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(MapState mapState, Map<String, Object> parameters) {
        double latitude = ((Number) parameters.get(MapToolNames.PARAM_LATITUDE)).doubleValue();
        double longitude = ((Number) parameters.get(MapToolNames.PARAM_LONGITUDE)).doubleValue();

        mapState.moveTo(longitude, latitude);
        log.debug("[Tools] Map center -> lat={}, lon={}", latitude, longitude);

        return CompletableFuture.completedFuture(ToolResult.success(
                "Map navigated to coordinates: " + latitude + ", " + longitude,
                Map.of("coordinates", Map.of(
                        MapToolNames.PARAM_LATITUDE, latitude,
                        MapToolNames.PARAM_LONGITUDE, longitude))));
    }
}
