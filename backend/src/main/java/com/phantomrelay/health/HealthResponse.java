package com.phantomrelay.health;

/**
 * @param users distinct accounts registered since startup
 */
public record HealthResponse(String status, int users, long timestamp) {}
