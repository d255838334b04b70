package com.vanphong.backend.modules.page.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;
import com.vanphong.backend.modules.page.domain.PageType;
import com.vanphong.backend.modules.page.infrastructure.persistence.PageTypeRepository;

import org.springframework.stereotype.Component;

@Component
public class PageTypeMetadataTargetProvider implements MetadataTargetProvider {

    private final PageTypeRepository repository;

    public PageTypeMetadataTargetProvider(PageTypeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.PAGE_TYPE;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID id) {
        return repository.findById(id).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
        return repository.findByIdForUpdate(id).map(this::toTarget);
    }

    private MetadataTarget toTarget(PageType pageType) {
        return MetadataTarget.unowned(ResourceClass.PAGE_TYPE, pageType);
    }
}
