package com.questrail.courier.codec.impl;

import com.questrail.courier.codec.Serializer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSerializerRegistryTest {

    @Test
    void standardRegistryDefaultsToJson() {
        DefaultSerializerRegistry registry = DefaultSerializerRegistry.standard(List.of());

        assertEquals(Set.of("json", "gzip-json"), registry.names());
        assertEquals("json", registry.nameOf(registry.defaultSerializer()));
        assertInstanceOf(GzipJsonSerializer.class, registry.lookup("gzip-json"));
    }

    @Test
    void unknownOrMissingNamesResolveToDefault() {
        DefaultSerializerRegistry registry = DefaultSerializerRegistry.standardBuilder(List.of())
                .withDefault("gzip-json")
                .build();

        assertSame(registry.defaultSerializer(), registry.lookup("avro"));
        assertSame(registry.defaultSerializer(), registry.lookup(null));
        assertInstanceOf(GzipJsonSerializer.class, registry.defaultSerializer());
    }

    @Test
    void nameOfUnregisteredSerializerFails() {
        DefaultSerializerRegistry registry = DefaultSerializerRegistry.standard(List.of());
        Serializer stranger = new JsonSerializer();

        assertThrows(IllegalArgumentException.class, () -> registry.nameOf(stranger));
    }

    @Test
    void firstRegisteredIsDefaultWhenNoneNamed() {
        JsonSerializer json = new JsonSerializer();
        DefaultSerializerRegistry registry = DefaultSerializerRegistry.builder()
                .register("plain", json)
                .register("packed", new GzipJsonSerializer(json))
                .build();

        assertSame(json, registry.defaultSerializer());
    }

    @Test
    void unknownDefaultNameFails() {
        DefaultSerializerRegistry.Builder builder = DefaultSerializerRegistry.standardBuilder(List.of())
                .withDefault("avro");

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void emptyOrBlankRegistrationsFail() {
        assertThrows(IllegalStateException.class, () -> DefaultSerializerRegistry.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> DefaultSerializerRegistry.builder().register(" ", new JsonSerializer()));
    }
}
