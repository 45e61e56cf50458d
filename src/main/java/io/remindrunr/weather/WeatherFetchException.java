package io.remindrunr.weather;

/**
 * Raised when a weather source cannot return data: HTTP error, timeout or missing API key.
 */
public class WeatherFetchException extends RuntimeException {

    public WeatherFetchException(String message) {
        super(message);
    }

    public WeatherFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
