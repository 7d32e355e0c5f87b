package me.golemcore.map.domain.model;

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

/**
 * Current map view of a single connection: center point and zoom level.
 *
 * <p>
 * The center is stored as longitude/latitude. Coordinates are accepted as
 * given (no range checks), while the zoom level is always kept inside
 * {@link #MIN_ZOOM}..{@link #MAX_ZOOM}.
 *
 * <p>
 * Instances are owned by one {@link MapSession} and mutated only by tool
 * handlers running on that session's worker. Anything that leaves the session
 * is a {@link MapSnapshot} copy.
 *
 * @since 1.0
 */
public class MapState {

    public static final int MIN_ZOOM = 0;
    public static final int MAX_ZOOM = 20;

    private double longitude;
    private double latitude;
    private int zoom;

    public MapState(double longitude, double latitude, int zoom) {
        this.longitude = longitude;
        this.latitude = latitude;
        this.zoom = clampZoom(zoom);
    }

    public void moveTo(double longitude, double latitude) {
        this.longitude = longitude;
        this.latitude = latitude;
    }

    /**
     * Sets the zoom level, clamping it into the supported range.
     *
     * @return the level actually stored
     */
    public int zoomTo(long level) {
        this.zoom = clampZoom(level);
        return this.zoom;
    }

    public MapSnapshot snapshot() {
        return MapSnapshot.of(longitude, latitude, zoom);
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public int getZoom() {
        return zoom;
    }

    public static int clampZoom(long level) {
        return (int) Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, level));
    }

    @Override
    public String toString() {
        return "MapState{center=[" + longitude + ", " + latitude + "], zoom=" + zoom + "}";
    }
}
