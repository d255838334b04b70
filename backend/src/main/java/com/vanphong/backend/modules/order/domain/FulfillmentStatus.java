package com.vanphong.backend.modules.order.domain;

public enum FulfillmentStatus {
    FULFILLED,
    CANCELED,
    REFUNDED,
    WAITING_FOR_APPROVAL
}
