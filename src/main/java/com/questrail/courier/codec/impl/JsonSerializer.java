package com.questrail.courier.codec.impl;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.questrail.courier.codec.Serializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON serializer backed by Jackson databind.
 *
 * <p>Every non-scalar value is written with an {@code "@class"} property so the
 * body can be decoded without a type hint. Strings, numbers and booleans are
 * written as plain JSON scalars.</p>
 *
 * <p>Only classes whose names start with one of the allowed prefixes can be
 * instantiated on decode. {@code java.lang.}, {@code java.util.},
 * {@code java.math.} and {@code com.questrail.courier.} are always allowed, as
 * are arrays. {@link #toBinary(Object)} refuses a message whose own class is
 * outside that set, so the sender fails instead of the receiver.</p>
 */
public final class JsonSerializer implements Serializer
{
    static final List<String> BUILT_IN_PREFIXES = List.of(
            "java.lang.",
            "java.util.",
            "java.math.",
            "com.questrail.courier."
    );

    private final List<String> allowedPrefixes;
    private final ObjectMapper mapper;

    public JsonSerializer(List<String> allowedPackagePrefixes) {
        Objects.requireNonNull(allowedPackagePrefixes, "allowedPackagePrefixes");

        BasicPolymorphicTypeValidator.Builder validator = BasicPolymorphicTypeValidator.builder();
        List<String> prefixes = new ArrayList<>(BUILT_IN_PREFIXES);
        prefixes.addAll(allowedPackagePrefixes);
        for (String prefix : prefixes) {
            validator.allowIfSubType(prefix);
        }
        validator.allowIfSubTypeIsArray();
        this.allowedPrefixes = List.copyOf(prefixes);

        this.mapper = new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.mapper.activateDefaultTyping(
                validator.build(),
                ObjectMapper.DefaultTyping.EVERYTHING,
                JsonTypeInfo.As.PROPERTY);
    }

    public JsonSerializer() {
        this(List.of());
    }

    @Override
    public byte[] toBinary(Object message) throws IOException {
        if (message != null && !isDecodable(message.getClass())) {
            throw new IOException(message.getClass().getName()
                    + " is outside the allowed packages " + allowedPrefixes);
        }
        return mapper.writeValueAsBytes(message);
    }

    @Override
    public Object fromBinary(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, Object.class);
    }

    private boolean isDecodable(Class<?> type) {
        if (type.isArray()) {
            return true;
        }
        String name = type.getName();
        for (String prefix : allowedPrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "JsonSerializer";
    }
}
