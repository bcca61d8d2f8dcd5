package io.botpoll.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Returns the codec of the first registered {@link JsonCodecProvider}.
     *
     * @param cl class loader to search
     * @return the discovered codec
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (providers.hasNext()) {
            JsonCodec codec = providers.next().codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException(
                "No JsonCodecProvider registered; add botpoll-json-jackson to the classpath or configure a codec explicitly");
    }
}
