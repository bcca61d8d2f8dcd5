package io.botpoll.json.spi;

import java.util.List;
import java.util.Objects;

/**
 * Library-neutral description of a possibly generic target type, such as
 * {@code Envelope<List<Update>>}.
 *
 * <p>Codecs translate it into their own type model.
 *
 * @param <T> the described type
 */
public final class ValueType<T> {

    private final Class<?> rawType;
    private final List<ValueType<?>> parameters;

    private ValueType(Class<?> rawType, List<ValueType<?>> parameters) {
        this.rawType = Objects.requireNonNull(rawType, "rawType");
        this.parameters = List.copyOf(parameters);
    }

    public static <T> ValueType<T> of(Class<T> type) {
        return new ValueType<>(type, List.of());
    }

    public static <T> ValueType<List<T>> listOf(Class<T> elementType) {
        return listOf(of(elementType));
    }

    public static <T> ValueType<List<T>> listOf(ValueType<T> elementType) {
        return new ValueType<>(List.class, List.of(elementType));
    }

    /**
     * Describes {@code rawType<parameters...>}. The caller is responsible for matching the type
     * variable to {@code rawType}'s declaration.
     */
    public static <T> ValueType<T> parameterized(Class<?> rawType, ValueType<?>... parameters) {
        return new ValueType<>(rawType, List.of(parameters));
    }

    public Class<?> rawType() {
        return rawType;
    }

    public List<ValueType<?>> parameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ValueType)) return false;
        ValueType<?> that = (ValueType<?>) other;
        return rawType.equals(that.rawType) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawType, parameters);
    }

    @Override
    public String toString() {
        if (parameters.isEmpty()) return rawType.getName();
        StringBuilder sb = new StringBuilder(rawType.getName()).append('<');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i));
        }
        return sb.append('>').toString();
    }
}
