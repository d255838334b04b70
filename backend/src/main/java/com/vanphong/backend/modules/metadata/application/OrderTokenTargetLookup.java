package com.vanphong.backend.modules.metadata.application;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves orders and their fulfillments by the order's secret token. Returned targets are
 * marked as token lookups.
 */
public interface OrderTokenTargetLookup {

    Optional<MetadataTarget> findOrderByToken(UUID token);

    Optional<MetadataTarget> findFulfillmentByOrderToken(UUID token, UUID fulfillmentId);
}
