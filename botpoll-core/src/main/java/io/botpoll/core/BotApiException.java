package io.botpoll.core;

/**
 * Base class for bot API related exceptions.
 *
 * <p>Each subclass stands for one error kind. Subclasses keep the original cause when there is one,
 * so the underlying HTTP or JSON failure stays inspectable.
 */
public abstract class BotApiException extends RuntimeException {

    protected BotApiException(String message) {
        super(message);
    }

    protected BotApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the request could not be carried out (connection refused, timeout, I/O error).
     */
    public static class TransportFailure extends BotApiException {
        public TransportFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the response body is not valid JSON or does not match the expected type.
     */
    public static class MalformedResponse extends BotApiException {
        public MalformedResponse(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the remote side answered with {@code ok=false} and a description.
     */
    public static class ApiError extends BotApiException {
        private final String description;
        private final Integer errorCode;

        public ApiError(String description, Integer errorCode) {
            super(errorCode == null ? description : "[" + errorCode + "] " + description);
            this.description = description;
            this.errorCode = errorCode;
        }

        public String description() {
            return description;
        }

        /**
         * Numeric error code reported next to the description, or {@code null} if absent.
         */
        public Integer errorCode() {
            return errorCode;
        }
    }

    /**
     * Raised when a response envelope breaks its own contract, e.g. {@code ok=true} without a result.
     */
    public static class InvalidState extends BotApiException {
        public InvalidState(String message) {
            super(message);
        }
    }

    /**
     * Raised when a bot token cannot be used to form the API URL.
     */
    public static class InvalidToken extends BotApiException {
        public InvalidToken(String message) {
            super(message);
        }

        public InvalidToken(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the environment variable expected to hold the token is missing or empty.
     */
    public static class InvalidEnvironmentVariable extends BotApiException {
        public InvalidEnvironmentVariable(String message) {
            super(message);
        }
    }
}
