package dev.aparikh.lightsearch;

/**
 * Thrown when an insertion configuration is malformed, for example a non-positive
 * batch size or an identifier function that produced no usable identifier.
 */
public class InvalidConfigException extends LightSearchException {

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
