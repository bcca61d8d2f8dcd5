package io.botpoll.http.spi;

/**
 * No response arrived within the request's timeout, or the adapter's default when the request
 * carries none.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(String message) {
        super(message);
    }

    public HttpTimeoutException(Throwable cause) {
        super(cause);
    }
}
