package com.vanphong.backend.modules.order.domain;

public enum OrderStatus {
    DRAFT,
    UNCONFIRMED,
    UNFULFILLED,
    PARTIALLY_FULFILLED,
    FULFILLED,
    CANCELED
}
