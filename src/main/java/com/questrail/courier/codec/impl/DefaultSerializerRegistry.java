package com.questrail.courier.codec.impl;

import com.questrail.courier.codec.Serializer;
import com.questrail.courier.codec.SerializerRegistry;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable {@link SerializerRegistry} built once at startup.
 */
public final class DefaultSerializerRegistry implements SerializerRegistry
{
    public static final String JSON = "json";
    public static final String GZIP_JSON = "gzip-json";

    private final Map<String, Serializer> byName;
    private final Map<Serializer, String> byInstance;
    private final Serializer defaultSerializer;

    private DefaultSerializerRegistry(Map<String, Serializer> byName, String defaultName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));

        Map<Serializer, String> reverse = new IdentityHashMap<>();
        byName.forEach((name, serializer) -> reverse.putIfAbsent(serializer, name));
        this.byInstance = Collections.unmodifiableMap(reverse);

        this.defaultSerializer = byName.get(defaultName);
        if (defaultSerializer == null) {
            throw new IllegalStateException("Default serializer is not registered: " + defaultName);
        }
    }

    /**
     * Registry with {@code json} and {@code gzip-json}, defaulting to {@code json}.
     *
     * @param allowedPackagePrefixes extra package prefixes JSON may instantiate
     */
    public static DefaultSerializerRegistry standard(List<String> allowedPackagePrefixes) {
        return standardBuilder(allowedPackagePrefixes).build();
    }

    public static Builder standardBuilder(List<String> allowedPackagePrefixes) {
        JsonSerializer json = new JsonSerializer(allowedPackagePrefixes);
        return builder()
                .register(JSON, json)
                .register(GZIP_JSON, new GzipJsonSerializer(json))
                .withDefault(JSON);
    }

    @Override
    public Serializer lookup(String name) {
        if (name == null) {
            return defaultSerializer;
        }
        return byName.getOrDefault(name, defaultSerializer);
    }

    @Override
    public String nameOf(Serializer serializer) {
        Objects.requireNonNull(serializer, "serializer");
        String name = byInstance.get(serializer);
        if (name == null) {
            throw new IllegalArgumentException("Unregistered serializer: " + serializer);
        }
        return name;
    }

    @Override
    public Serializer defaultSerializer() {
        return defaultSerializer;
    }

    public Set<String> names() {
        return byName.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Serializer> serializers = new LinkedHashMap<>();
        private String defaultName;

        private Builder() {}

        public Builder register(String name, Serializer serializer) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Serializer name must not be blank");
            }
            serializers.put(name, Objects.requireNonNull(serializer, "serializer"));
            return this;
        }

        public Builder withDefault(String name) {
            this.defaultName = Objects.requireNonNull(name, "name");
            return this;
        }

        public DefaultSerializerRegistry build() {
            if (serializers.isEmpty()) {
                throw new IllegalStateException("At least one serializer required");
            }
            String effectiveDefault = defaultName != null ? defaultName : serializers.keySet().iterator().next();
            return new DefaultSerializerRegistry(serializers, effectiveDefault);
        }
    }
}
