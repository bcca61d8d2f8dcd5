package io.botpoll.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.type.TypeFactory;
import io.botpoll.json.spi.JsonCodec;
import io.botpoll.json.spi.JsonException;
import io.botpoll.json.spi.ValueType;

import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Uses snake_case property names, ignores unknown properties and skips nulls on write.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper configuration.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, ValueType<T> type) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot deserialize empty data to " + type);
        }
        try {
            return mapper.readValue(data, toJavaType(type));
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type, e);
        }
    }

    JavaType toJavaType(ValueType<?> type) {
        TypeFactory factory = mapper.getTypeFactory();
        List<ValueType<?>> parameters = type.parameters();
        if (parameters.isEmpty()) {
            return factory.constructType(type.rawType());
        }
        JavaType[] bound = new JavaType[parameters.size()];
        for (int i = 0; i < bound.length; i++) {
            bound[i] = toJavaType(parameters.get(i));
        }
        return factory.constructParametricType(type.rawType(), bound);
    }
}
