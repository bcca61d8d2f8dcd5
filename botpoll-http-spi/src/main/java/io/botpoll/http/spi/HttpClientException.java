package io.botpoll.http.spi;

/**
 * The HTTP exchange itself failed: no connection, a reset, or an interrupted call.
 * An error status is not a failure here; it comes back as an {@link HttpClientResponse}.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
