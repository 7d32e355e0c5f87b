package me.golemcore.map.domain.parsing;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Table of well-known place names with their coordinates.
 *
 * <p>
 * Names are matched case-insensitively as whole words. When several names
 * occur in the same text the longest one wins, so "statue of liberty" beats a
 * shorter name it might contain.
 *
 * <p>
 * Loaded from a JSON array of {@code {"name", "latitude", "longitude"}}
 * objects, see {@link #load(InputStream, ObjectMapper)}.
 *
 * @since 1.0
 */
public final class Gazetteer {

    private final List<Entry> entries;

    public Gazetteer(List<Place> places) {
        List<Entry> compiled = new ArrayList<>();
        for (Place place : places) {
            String name = place.name().toLowerCase(Locale.ROOT).trim();
            if (name.isEmpty()) {
                continue;
            }
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(name) + "\\b");
            compiled.add(new Entry(new Place(name, place.latitude(), place.longitude()), pattern));
        }
        compiled.sort(Comparator.comparingInt((Entry e) -> e.place().name().length()).reversed());
        this.entries = List.copyOf(compiled);
    }

    public static Gazetteer load(InputStream json, ObjectMapper objectMapper) throws IOException {
        List<Place> places = objectMapper.readValue(json, new TypeReference<List<Place>>() {
        });
        return new Gazetteer(places);
    }

    /**
     * Finds the longest known place name mentioned in the text.
     */
    public Optional<Place> findIn(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Entry entry : entries) {
            if (entry.pattern().matcher(lower).find()) {
                return Optional.of(entry.place());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * A named point.
     */
    public record Place(String name, double latitude, double longitude) {
    }

    private record Entry(Place place, Pattern pattern) {
    }
}
