package com.vanphong.backend.modules.metadata.application;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class MetadataTargetRegistry {

    private final Map<ResourceClass, MetadataTargetProvider> providers;

    public MetadataTargetRegistry(List<MetadataTargetProvider> providers) {
        Map<ResourceClass, MetadataTargetProvider> byClass = new EnumMap<>(ResourceClass.class);
        for (MetadataTargetProvider provider : providers) {
            MetadataTargetProvider previous = byClass.put(provider.resourceClass(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate metadata target provider for " + provider.resourceClass());
            }
        }
        for (ResourceClass resourceClass : ResourceClass.values()) {
            if (!byClass.containsKey(resourceClass)) {
                throw new IllegalStateException("No metadata target provider for " + resourceClass);
            }
        }
        this.providers = byClass;
    }

    public Optional<MetadataTarget> find(ResourceClass resourceClass, UUID id) {
        return providers.get(resourceClass).findById(id);
    }

    public Optional<MetadataTarget> findForUpdate(ResourceClass resourceClass, UUID id) {
        return providers.get(resourceClass).findByIdForUpdate(id);
    }
}
