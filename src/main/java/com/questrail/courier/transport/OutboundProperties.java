package com.questrail.courier.transport;

/**
 * The AMQP basic properties Courier sets on a publish. Any field may be
 * {@code null} except {@code deliveryMode}.
 */
public record OutboundProperties(String contentEncoding,
                                 String contentType,
                                 String correlationId,
                                 String replyTo,
                                 int deliveryMode)
{
}
