package me.golemcore.map.port.outbound;

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

import me.golemcore.map.domain.model.GeocodeMatch;

import java.util.Optional;

/**
 * Port for resolving free-form addresses to coordinates.
 */
public interface GeocodingPort {

    /**
     * Looks up an address and returns the top-ranked candidate. One outbound
     * request per call, no retries.
     *
     * @param address
     *            free-form address or place name
     * @return the best match, or empty when the service found no candidates
     * @throws GeocodingException
     *             on transport failures, HTTP errors, service errors or a
     *             candidate without coordinates
     */
    Optional<GeocodeMatch> findBestMatch(String address);
}
