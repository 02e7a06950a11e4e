package com.docverify.model;

public enum DeliveryStatus {
    DELIVERED,
    FAILED
}
