package dev.aparikh.lightsearch;

/**
 * Base type of every error raised by the ingestion pipeline.
 *
 * <p>All failures are unchecked and surface synchronously to the caller of
 * {@code insert} or through the future returned by {@code insertBatch}.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class LightSearchException extends RuntimeException {

    public LightSearchException(String message) {
        super(message);
    }

    public LightSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
