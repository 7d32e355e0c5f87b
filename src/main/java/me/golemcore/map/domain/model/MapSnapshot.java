package me.golemcore.map.domain.model;

import java.util.List;

/**
 * Immutable copy of a {@link MapState}. Serializes to the wire shape
 * {@code {"center": [lon, lat], "zoom": z}}.
 */
public record MapSnapshot(List<Double> center, int zoom) {

    public MapSnapshot {
        center = List.copyOf(center);
    }

    public static MapSnapshot of(double longitude, double latitude, int zoom) {
        return new MapSnapshot(List.of(longitude, latitude), zoom);
    }

    public double longitude() {
        return center.get(0);
    }

    public double latitude() {
        return center.get(1);
    }
}
