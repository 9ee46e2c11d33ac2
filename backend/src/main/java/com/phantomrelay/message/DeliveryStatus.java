package com.phantomrelay.message;

public enum DeliveryStatus {
    DELIVERED("delivered"),
    QUEUED("queued");

    private final String wireName;

    DeliveryStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
