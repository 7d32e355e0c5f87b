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

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sets the zoom level. Out-of-range levels are clamped into 0..20, never
 * rejected.
 */
@Component
@Slf4j
public class ZoomToLevelTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(MapToolNames.ZOOM_TO_LEVEL)
                .description("Zoom the map to a specific level")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                MapToolNames.PARAM_ZOOM_LEVEL, Map.of(
                                        "type", "integer",
                                        "description", "Zoom level (0-20, where 0 is most zoomed out)")),
                        "required", List.of(MapToolNames.PARAM_ZOOM_LEVEL)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(MapState mapState, Map<String, Object> parameters) {
        Number requested = (Number) parameters.get(MapToolNames.PARAM_ZOOM_LEVEL);
        int stored = mapState.zoomTo(toLong(requested));
        log.debug("[Tools] Zoom requested={}, stored={}", requested, stored);

        String output = "Map zoomed to level: " + stored;
        if (toLong(requested) != stored) {
            output += " (requested " + requested + ", clamped to " + MapState.MIN_ZOOM + "-" + MapState.MAX_ZOOM
                    + ")";
        }
        return CompletableFuture.completedFuture(ToolResult.success(output,
                Map.of(MapToolNames.PARAM_ZOOM_LEVEL, stored)));
    }

    private static long toLong(Number value) {
        if (value instanceof BigInteger big && big.bitLength() >= Long.SIZE) {
            return big.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return value.longValue();
    }
}
