package io.botpoll.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Modules such as {@code botpoll-json-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
