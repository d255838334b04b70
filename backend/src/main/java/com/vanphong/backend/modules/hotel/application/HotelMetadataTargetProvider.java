package com.vanphong.backend.modules.hotel.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.hotel.domain.Hotel;
import com.vanphong.backend.modules.hotel.infrastructure.persistence.HotelRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class HotelMetadataTargetProvider implements MetadataTargetProvider {

    private final HotelRepository repository;

    public HotelMetadataTargetProvider(HotelRepository repository) {
        this.repository = repository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.HOTEL;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID id) {
        return repository.findById(id).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
        return repository.findByIdForUpdate(id).map(this::toTarget);
    }

    private MetadataTarget toTarget(Hotel hotel) {
        return MetadataTarget.unowned(ResourceClass.HOTEL, hotel);
    }
}
