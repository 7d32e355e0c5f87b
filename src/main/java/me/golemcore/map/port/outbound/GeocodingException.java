package me.golemcore.map.port.outbound;

/**
 * Failure of the geocoding service or of the exchange with it.
 */
public class GeocodingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
