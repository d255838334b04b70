package com.vanphong.backend.modules.attribute.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.attribute.domain.Attribute;
import com.vanphong.backend.modules.attribute.infrastructure.persistence.AttributeRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class AttributeMetadataTargetProvider implements MetadataTargetProvider {

    private final AttributeRepository repository;

    public AttributeMetadataTargetProvider(AttributeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.ATTRIBUTE;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID id) {
        return repository.findById(id).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
        return repository.findByIdForUpdate(id).map(this::toTarget);
    }

    private MetadataTarget toTarget(Attribute attribute) {
        return MetadataTarget.unowned(ResourceClass.ATTRIBUTE, attribute);
    }
}
