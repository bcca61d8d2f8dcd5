package io.botpoll.core;

/**
 * Wire-level wrapper around every API response: {@code {ok, result?, description?, error_code?}}.
 *
 * <p>The contract is not expressed in the types: {@code ok=true} implies a result, {@code ok=false}
 * implies a description. {@link #unwrap()} enforces it.
 *
 * @param ok success flag
 * @param result the typed result, present on success
 * @param description human readable error, present on failure
 * @param errorCode optional numeric error code accompanying a failure
 * @param <T> result type
 */
public record Envelope<T>(boolean ok, T result, String description, Integer errorCode) {

    public static <T> Envelope<T> success(T result) {
        return new Envelope<>(true, result, null, null);
    }

    public static <T> Envelope<T> failure(String description, Integer errorCode) {
        return new Envelope<>(false, null, description, errorCode);
    }

    /**
     * Returns the result or throws the error the envelope describes.
     *
     * @return the result of a successful call
     * @throws BotApiException.ApiError if the remote side reported a failure
     * @throws BotApiException.InvalidState if the envelope violates its contract
     */
    public T unwrap() {
        if (ok && result != null) {
            return result;
        }
        if (!ok && description != null) {
            throw new BotApiException.ApiError(description, errorCode);
        }
        throw new BotApiException.InvalidState(ok
                ? "Invalid server response: ok=true without result"
                : "Invalid server response: ok=false without description");
    }
}
