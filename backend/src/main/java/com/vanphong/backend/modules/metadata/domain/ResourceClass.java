package com.vanphong.backend.modules.metadata.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of records that carry metadata, addressed over HTTP by their path segment.
 */
public enum ResourceClass {
    USER("users"),
    APP("apps"),
    CHECKOUT("checkouts"),
    ORDER("orders"),
    FULFILLMENT("fulfillments"),
    CATEGORY("categories"),
    COLLECTION("collections"),
    ATTRIBUTE("attributes"),
    ROOM("rooms"),
    ROOM_TYPE("room-types"),
    ROOM_VARIANT("room-variants"),
    DIGITAL_CONTENT("digital-contents"),
    PAGE_TYPE("page-types"),
    HOTEL("hotels");

    private final String pathSegment;

    ResourceClass(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }

    public String notFoundCode() {
        return name().toLowerCase(Locale.ROOT) + "_not_found";
    }

    public static Optional<ResourceClass> fromPathSegment(String segment) {
        if (segment == null) {
            return Optional.empty();
        }
        String normalized = segment.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(resourceClass -> resourceClass.pathSegment.equals(normalized))
                .findFirst();
    }
}
