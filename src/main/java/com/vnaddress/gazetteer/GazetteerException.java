package com.vnaddress.gazetteer;

/**
 * Raised while loading or building a {@link Gazetteer} from malformed reference data.
 * Never raised while resolving an address.
 */
public class GazetteerException extends RuntimeException {

    public GazetteerException(String message) {
        super(message);
    }

    public GazetteerException(String message, Throwable cause) {
        super(message, cause);
    }
}
