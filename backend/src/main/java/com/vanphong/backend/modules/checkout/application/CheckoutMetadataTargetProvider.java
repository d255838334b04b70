package com.vanphong.backend.modules.checkout.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.checkout.domain.Checkout;
import com.vanphong.backend.modules.checkout.infrastructure.persistence.CheckoutRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class CheckoutMetadataTargetProvider implements MetadataTargetProvider {

    private final CheckoutRepository checkoutRepository;

    public CheckoutMetadataTargetProvider(CheckoutRepository checkoutRepository) {
        this.checkoutRepository = checkoutRepository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.CHECKOUT;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID token) {
        return checkoutRepository.findById(token).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID token) {
        return checkoutRepository.findByIdForUpdate(token).map(this::toTarget);
    }

    private MetadataTarget toTarget(Checkout checkout) {
        return MetadataTarget.ownedByUser(ResourceClass.CHECKOUT, checkout, checkout.getUserId(), true);
    }
}
