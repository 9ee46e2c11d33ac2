package com.phantomrelay.message;

/**
 * @param deliveries number of open sessions that took the message; 0 when queued
 */
public record RouteResult(String messageId, DeliveryStatus status, int deliveries) {}
