package io.botpoll.http.spi;

import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 401, 502)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as a byte array.
     * @return the body bytes, never null
     */
    byte[] body();
}
