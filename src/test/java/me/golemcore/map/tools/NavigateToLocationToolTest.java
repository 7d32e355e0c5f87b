package me.golemcore.map.tools;

import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.domain.model.MapToolNames;
import me.golemcore.map.domain.model.ToolDefinition;
import me.golemcore.map.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NavigateToLocationToolTest {

    private final NavigateToLocationTool tool = new NavigateToLocationTool();

    @Test
    void shouldAdvertiseLatitudeAndLongitude() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals(MapToolNames.NAVIGATE_TO_LOCATION, definition.getName());
        assertEquals(List.of("latitude", "longitude"), definition.getRequired());
        assertTrue(definition.getProperties().containsKey("latitude"));
        assertTrue(definition.getProperties().containsKey("longitude"));
    }

    @Test
    void shouldMoveCenterKeepingZoom() {
        MapState state = new MapState(0, 0, 6);

        ToolResult result = tool.execute(state, Map.of("latitude", 51.5074, "longitude", -0.1278)).join();

        assertTrue(result.isSuccess());
        assertEquals("Map navigated to coordinates: 51.5074, -0.1278", result.getOutput());
        assertEquals(-0.1278, state.getLongitude());
        assertEquals(51.5074, state.getLatitude());
        assertEquals(6, state.getZoom());
    }

    @Test
    void shouldAcceptIntegerCoordinates() {
        MapState state = new MapState(0, 0, 2);

        tool.execute(state, Map.of("latitude", 10, "longitude", 20)).join();

        assertEquals(20.0, state.getLongitude());
        assertEquals(10.0, state.getLatitude());
    }

    @Test
    void shouldNotEnforceAdvertisedRanges() {
        MapState state = new MapState(0, 0, 2);

        ToolResult result = tool.execute(state, Map.of("latitude", 95.0, "longitude", 200.0)).join();

        assertTrue(result.isSuccess());
        assertEquals(95.0, state.getLatitude());
    }
}
