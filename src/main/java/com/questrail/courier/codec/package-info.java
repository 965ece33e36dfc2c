/**
 * Envelope codec
 * =============================================================================
 *
 * <p>Application messages cross the broker as an {@link com.questrail.courier.api.Envelope}:
 * body bytes plus two metadata strings.</p>
 *
 * <pre>
 *   Object
 *     → EnvelopeCodec.serialize(message, serializer)
 *         → Envelope{body, serializerId, typeName}
 *             → WireConvention (content-encoding / content-type)
 *                 → BrokerChannel.publish(...)
 * </pre>
 *
 * <p>The inbound direction reverses the chain. Serializer resolution is lenient:
 * an unknown serializer id decodes with the configured default.</p>
 */
package com.questrail.courier.codec;
