package io.botpoll.json.spi;

/**
 * A value could not be written as JSON, or a body could not be read as the requested
 * {@link ValueType}.
 */
public class JsonException extends Exception {

    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
