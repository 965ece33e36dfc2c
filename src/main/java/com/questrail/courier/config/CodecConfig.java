package com.questrail.courier.config;

import java.util.List;
import java.util.Objects;

/**
 * Envelope codec settings.
 *
 * @param legacyEncodingSwap     carry the serializer id in {@code content-type} and
 *                               the type name in {@code content-encoding}
 * @param defaultSerializer      serializer used when a received id is missing or unknown
 * @param allowedPackagePrefixes extra package prefixes the JSON serializers may instantiate
 */
public record CodecConfig(
    boolean legacyEncodingSwap,
    String defaultSerializer,
    List<String> allowedPackagePrefixes
) {
    public CodecConfig {
        Objects.requireNonNull(defaultSerializer, "defaultSerializer");
        allowedPackagePrefixes = List.copyOf(Objects.requireNonNull(allowedPackagePrefixes, "allowedPackagePrefixes"));
    }

    public static CodecConfig defaults() {
        return new CodecConfig(false, "json", List.of());
    }
}
