package com.vanphong.backend.modules.catalog.application;

import com.vanphong.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.vanphong.backend.modules.catalog.infrastructure.persistence.DigitalContentRepository;
import com.vanphong.backend.modules.catalog.infrastructure.persistence.RoomCollectionRepository;
import com.vanphong.backend.modules.catalog.infrastructure.persistence.RoomRepository;
import com.vanphong.backend.modules.catalog.infrastructure.persistence.RoomTypeRepository;
import com.vanphong.backend.modules.catalog.infrastructure.persistence.RoomVariantRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogMetadataTargets {

    @Bean
    public MetadataTargetProvider categoryMetadataTargetProvider(CategoryRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.CATEGORY, repository::findById, repository::findByIdForUpdate,
                category -> MetadataTarget.unowned(ResourceClass.CATEGORY, category));
    }

    @Bean
    public MetadataTargetProvider collectionMetadataTargetProvider(RoomCollectionRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.COLLECTION, repository::findById, repository::findByIdForUpdate,
                collection -> MetadataTarget.unowned(ResourceClass.COLLECTION, collection, collection.isPublished()));
    }

    @Bean
    public MetadataTargetProvider roomMetadataTargetProvider(RoomRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.ROOM, repository::findById, repository::findByIdForUpdate,
                room -> MetadataTarget.unowned(ResourceClass.ROOM, room, room.isPublished()));
    }

    @Bean
    public MetadataTargetProvider roomTypeMetadataTargetProvider(RoomTypeRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.ROOM_TYPE, repository::findById, repository::findByIdForUpdate,
                roomType -> MetadataTarget.unowned(ResourceClass.ROOM_TYPE, roomType));
    }

    // A variant is listed when its room is published.
    @Bean
    public MetadataTargetProvider roomVariantMetadataTargetProvider(RoomVariantRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.ROOM_VARIANT, repository::findWithRoomById, repository::findByIdForUpdate,
                variant -> MetadataTarget.unowned(ResourceClass.ROOM_VARIANT, variant, variant.getRoom().isPublished()));
    }

    @Bean
    public MetadataTargetProvider digitalContentMetadataTargetProvider(DigitalContentRepository repository) {
        return MetadataTargetProvider.of(ResourceClass.DIGITAL_CONTENT, repository::findById, repository::findByIdForUpdate,
                content -> MetadataTarget.unowned(ResourceClass.DIGITAL_CONTENT, content));
    }
}
