package me.golemcore.map.tools;

import me.golemcore.map.domain.model.MapState;
import me.golemcore.map.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ZoomToLevelToolTest {

    private final ZoomToLevelTool tool = new ZoomToLevelTool();

    @Test
    void shouldZoomToRequestedLevel() {
        MapState state = new MapState(0, 0, 2);

        ToolResult result = tool.execute(state, Map.of("zoom_level", 12)).join();

        assertTrue(result.isSuccess());
        assertEquals("Map zoomed to level: 12", result.getOutput());
        assertEquals(12, state.getZoom());
    }

    @Test
    void shouldClampAboveMaximumWithoutError() {
        MapState state = new MapState(0, 0, 2);

        ToolResult result = tool.execute(state, Map.of("zoom_level", 99)).join();

        assertTrue(result.isSuccess());
        assertEquals("Map zoomed to level: 20 (requested 99, clamped to 0-20)", result.getOutput());
        assertEquals(20, state.getZoom());
    }

    @Test
    void shouldClampBelowMinimum() {
        MapState state = new MapState(0, 0, 2);

        tool.execute(state, Map.of("zoom_level", -3)).join();

        assertEquals(0, state.getZoom());
    }

    @Test
    void shouldClampHugeIntegers() {
        MapState state = new MapState(0, 0, 2);

        tool.execute(state, Map.of("zoom_level", new BigInteger("-99999999999999999999999"))).join();
        assertEquals(0, state.getZoom());

        tool.execute(state, Map.of("zoom_level", new BigInteger("99999999999999999999999"))).join();
        assertEquals(20, state.getZoom());
    }

    @Test
    void shouldAcceptIntegralDouble() {
        MapState state = new MapState(0, 0, 2);

        tool.execute(state, Map.of("zoom_level", 7.0)).join();

        assertEquals(7, state.getZoom());
    }
}
