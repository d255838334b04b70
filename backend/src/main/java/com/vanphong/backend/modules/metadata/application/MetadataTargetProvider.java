package com.vanphong.backend.modules.metadata.application;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import com.vanphong.backend.modules.metadata.domain.ResourceClass;

/**
 * Loads a metadata-bearing record of one resource class by id. Each entity module registers one.
 */
public interface MetadataTargetProvider {

    ResourceClass resourceClass();

    Optional<MetadataTarget> findById(UUID id);

    /**
     * Same lookup as {@link #findById(UUID)}, holding a row write lock until the surrounding
     * transaction ends. Used before a metadata map is rewritten.
     */
    Optional<MetadataTarget> findByIdForUpdate(UUID id);

    static <T> MetadataTargetProvider of(
            ResourceClass resourceClass,
            Function<UUID, Optional<T>> finder,
            Function<UUID, Optional<T>> lockingFinder,
            Function<T, MetadataTarget> mapper
    ) {
        Objects.requireNonNull(resourceClass, "resourceClass is required");
        return new MetadataTargetProvider() {
            @Override
            public ResourceClass resourceClass() {
                return resourceClass;
            }

            @Override
            public Optional<MetadataTarget> findById(UUID id) {
                return finder.apply(id).map(mapper);
            }

            @Override
            public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
                return lockingFinder.apply(id).map(mapper);
            }
        };
    }
}
