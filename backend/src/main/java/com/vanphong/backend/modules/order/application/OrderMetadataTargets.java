package com.vanphong.backend.modules.order.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.application.OrderTokenTargetLookup;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;
import com.vanphong.backend.modules.order.domain.Fulfillment;
import com.vanphong.backend.modules.order.domain.Order;
import com.vanphong.backend.modules.order.infrastructure.persistence.FulfillmentRepository;
import com.vanphong.backend.modules.order.infrastructure.persistence.OrderRepository;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metadata lookups for orders and fulfillments, by id and through the order token.
 * Draft orders and their fulfillments are unlisted. A fulfillment is owned by the order's customer.
 */
@Configuration
public class OrderMetadataTargets implements OrderTokenTargetLookup {

    private final OrderRepository orderRepository;
    private final FulfillmentRepository fulfillmentRepository;

    public OrderMetadataTargets(OrderRepository orderRepository, FulfillmentRepository fulfillmentRepository) {
        this.orderRepository = orderRepository;
        this.fulfillmentRepository = fulfillmentRepository;
    }

    @Bean
    public MetadataTargetProvider orderMetadataTargetProvider() {
        return MetadataTargetProvider.of(ResourceClass.ORDER, orderRepository::findById,
                orderRepository::findByIdForUpdate, OrderMetadataTargets::toOrderTarget);
    }

    @Bean
    public MetadataTargetProvider fulfillmentMetadataTargetProvider() {
        return MetadataTargetProvider.of(ResourceClass.FULFILLMENT, fulfillmentRepository::findWithOrderById,
                fulfillmentRepository::findByIdForUpdate, OrderMetadataTargets::toFulfillmentTarget);
    }

    @Override
    public Optional<MetadataTarget> findOrderByToken(UUID token) {
        return orderRepository.findByToken(token)
                .map(OrderMetadataTargets::toOrderTarget)
                .map(MetadataTarget::viaToken);
    }

    @Override
    public Optional<MetadataTarget> findFulfillmentByOrderToken(UUID token, UUID fulfillmentId) {
        return fulfillmentRepository.findByIdAndOrderToken(fulfillmentId, token)
                .map(OrderMetadataTargets::toFulfillmentTarget)
                .map(MetadataTarget::viaToken);
    }

    static MetadataTarget toOrderTarget(Order order) {
        return MetadataTarget.ownedByUser(ResourceClass.ORDER, order, order.getUserId(), !order.isDraft());
    }

    static MetadataTarget toFulfillmentTarget(Fulfillment fulfillment) {
        Order order = fulfillment.getOrder();
        return MetadataTarget.ownedByUser(ResourceClass.FULFILLMENT, fulfillment, order.getUserId(), !order.isDraft());
    }
}
