package com.questrail.courier.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a {@link CourierConfig} from a YAML document.
 *
 * <pre>
 * courier:
 *   amqp:
 *     host: localhost
 *     port: 5672
 *     username: guest
 *     password: guest
 *     vhost: /
 *   codec:
 *     legacySerializerEncodingSwap: false
 *     defaultSerializer: json
 *     allowedPackages: [com.example.messages.]
 *   proxies:
 *     calculator:
 *       exchange: { name: amq.direct, passive: true }
 *       queue: { name: calculator, randomizeName: false }
 *       channel: { qos: 4, global: false }
 * </pre>
 *
 * <p>Every key is optional. Missing keys keep the defaults of
 * {@link BrokerConfig.Builder}, {@link CodecConfig#defaults()} and
 * {@link EndpointConfig#defaults(String)}.</p>
 */
public final class YamlCourierConfigLoader {

    private YamlCourierConfigLoader() {}

    /**
     * @throws IOException when the file cannot be read
     * @throws IllegalArgumentException when the YAML structure or a value is invalid
     */
    public static CourierConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    public static CourierConfig load(Reader reader, String sourceName) {
        Objects.requireNonNull(reader, "reader");
        final Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException ex) {
            throw new IllegalArgumentException("Failed to parse YAML config at " + sourceName, ex);
        }

        CourierConfig.Builder builder = CourierConfig.builder();
        if (document == null) {
            return builder.build();
        }

        Map<String, Object> root = asMap(document, "root");
        Map<String, Object> courier = section(root, "courier");

        builder.withBroker(brokerConfig(section(courier, "amqp")));
        builder.withCodec(codecConfig(section(courier, "codec")));

        Map<String, Object> proxies = section(courier, "proxies");
        for (Map.Entry<String, Object> entry : proxies.entrySet()) {
            String name = entry.getKey();
            builder.addEndpoint(endpointConfig(name, asMap(entry.getValue(), "proxies." + name)));
        }
        return builder.build();
    }

    private static BrokerConfig brokerConfig(Map<String, Object> amqp) {
        BrokerConfig.Builder b = BrokerConfig.builder();
        if (amqp.containsKey("host")) {
            b.withHost(string(amqp, "host"));
        }
        if (amqp.containsKey("port")) {
            b.withPort(integer(amqp, "port", "amqp"));
        }
        if (amqp.containsKey("username")) {
            b.withUsername(string(amqp, "username"));
        }
        if (amqp.containsKey("password")) {
            b.withPassword(string(amqp, "password"));
        }
        if (amqp.containsKey("vhost")) {
            b.withVirtualHost(string(amqp, "vhost"));
        }
        return b.build();
    }

    private static CodecConfig codecConfig(Map<String, Object> codec) {
        CodecConfig defaults = CodecConfig.defaults();
        boolean swap = bool(codec, "legacySerializerEncodingSwap", defaults.legacyEncodingSwap(), "codec");
        String defaultSerializer = codec.containsKey("defaultSerializer")
                ? string(codec, "defaultSerializer")
                : defaults.defaultSerializer();
        return new CodecConfig(swap, defaultSerializer, stringList(codec.get("allowedPackages"), "codec.allowedPackages"));
    }

    private static EndpointConfig endpointConfig(String name, Map<String, Object> proxy) {
        EndpointConfig defaults = EndpointConfig.defaults(name);
        String context = "proxies." + name;

        Map<String, Object> ex = section(proxy, "exchange");
        ExchangeParameters d = defaults.exchange();
        ExchangeParameters exchange = new ExchangeParameters(
                ex.containsKey("name") ? string(ex, "name") : d.name(),
                ex.containsKey("type") ? string(ex, "type") : d.type(),
                bool(ex, "durable", d.durable(), context + ".exchange"),
                bool(ex, "autodelete", d.autodelete(), context + ".exchange"),
                bool(ex, "passive", d.passive(), context + ".exchange"));

        Map<String, Object> q = section(proxy, "queue");
        QueueParameters dq = defaults.queue();
        QueueParameters queue = new QueueParameters(
                q.containsKey("name") ? string(q, "name") : dq.name(),
                bool(q, "randomizeName", dq.randomize(), context + ".queue"),
                bool(q, "durable", dq.durable(), context + ".queue"),
                bool(q, "exclusive", dq.exclusive(), context + ".queue"),
                bool(q, "autodelete", dq.autodelete(), context + ".queue"),
                bool(q, "passive", dq.passive(), context + ".queue"));

        Map<String, Object> ch = section(proxy, "channel");
        ChannelParameters dc = defaults.channel();
        ChannelParameters channel = new ChannelParameters(
                ch.containsKey("qos") ? integer(ch, "qos", context + ".channel") : dc.prefetchCount(),
                bool(ch, "global", dc.prefetchIsGlobal(), context + ".channel"));

        return new EndpointConfig(name, exchange, queue, channel);
    }

    // ---------------------------------------------------------------------
    // YAML helpers
    // ---------------------------------------------------------------------

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object node = parent.get(key);
        if (node == null) {
            return Map.of();
        }
        return asMap(node, key);
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException(context + " section must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(context + " section contains non-string key");
            }
            map.put(key, entry.getValue());
        }
        return map;
    }

    private static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? "" : value.toString();
    }

    private static int integer(Map<String, Object> map, String key, String context) {
        Object value = map.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(context + "." + key + " must be an integer, was " + value, ex);
        }
    }

    private static boolean bool(Map<String, Object> map, String key, boolean fallback, String context) {
        if (!map.containsKey(key)) {
            return fallback;
        }
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException(context + "." + key + " must be true or false, was " + value);
    }

    private static List<String> stringList(Object value, String context) {
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item == null) {
                    throw new IllegalArgumentException(context + " contains a null entry");
                }
                result.add(item.toString().trim());
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
