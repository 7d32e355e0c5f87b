package me.golemcore.map.domain.model;

/**
 * Best geocoding candidate for an address.
 *
 * @param latitude
 *            candidate latitude
 * @param longitude
 *            candidate longitude
 * @param score
 *            service confidence, 0..100
 * @param formattedAddress
 *            address as the service formats it, may be {@code null}
 * @param candidateCount
 *            number of candidates the service returned
 */
public record GeocodeMatch(double latitude, double longitude, double score, String formattedAddress,
        int candidateCount) {
}
