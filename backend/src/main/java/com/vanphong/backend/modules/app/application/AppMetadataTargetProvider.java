package com.vanphong.backend.modules.app.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.app.domain.App;
import com.vanphong.backend.modules.app.infrastructure.persistence.AppRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class AppMetadataTargetProvider implements MetadataTargetProvider {

    private final AppRepository appRepository;

    public AppMetadataTargetProvider(AppRepository appRepository) {
        this.appRepository = appRepository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.APP;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID id) {
        return appRepository.findById(id).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
        return appRepository.findByIdForUpdate(id).map(this::toTarget);
    }

    private MetadataTarget toTarget(App app) {
        return MetadataTarget.app(app);
    }
}
