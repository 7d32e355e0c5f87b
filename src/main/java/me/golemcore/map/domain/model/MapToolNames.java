package me.golemcore.map.domain.model;

import java.util.List;

/**
 * Names of the map tools and their parameters, shared by the tools, the
 * response normalizer and the prompt.
 */
public final class MapToolNames {

    public static final String NAVIGATE_TO_LOCATION = "navigate_to_location";
    public static final String ZOOM_TO_LEVEL = "zoom_to_level";
    public static final String GEOCODE_ADDRESS = "geocode_address";

    public static final List<String> ALL = List.of(NAVIGATE_TO_LOCATION, ZOOM_TO_LEVEL, GEOCODE_ADDRESS);

    public static final String PARAM_LATITUDE = "latitude";
    public static final String PARAM_LONGITUDE = "longitude";
    public static final String PARAM_ZOOM_LEVEL = "zoom_level";
    public static final String PARAM_ADDRESS = "address";

    private MapToolNames() {
    }
}
