package com.vanphong.backend.modules.metadata.application;

import java.util.Objects;
import java.util.UUID;

import com.vanphong.backend.modules.metadata.domain.AbstractMetadataEntity;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

/**
 * Snapshot of a metadata-bearing record as the access policy sees it.
 *
 * @param ownerUserId  user owning the record (the user itself for accounts), if any
 * @param ownerAppId   app owning the record (the app itself for apps), if any
 * @param staffAccount true when the record is a staff user account
 * @param listed       false for unpublished catalog items and draft orders
 * @param accessPath   how the record was looked up
 */
public record MetadataTarget(
        ResourceClass resourceClass,
        UUID id,
        UUID ownerUserId,
        UUID ownerAppId,
        boolean staffAccount,
        boolean listed,
        AccessPath accessPath,
        AbstractMetadataEntity entity
) {

    public enum AccessPath {
        DIRECT,
        TOKEN
    }

    public MetadataTarget {
        Objects.requireNonNull(resourceClass, "resourceClass is required");
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(entity, "entity is required");
        accessPath = accessPath == null ? AccessPath.DIRECT : accessPath;
    }

    public static MetadataTarget unowned(ResourceClass resourceClass, AbstractMetadataEntity entity) {
        return unowned(resourceClass, entity, true);
    }

    public static MetadataTarget unowned(ResourceClass resourceClass, AbstractMetadataEntity entity, boolean listed) {
        return new MetadataTarget(resourceClass, entity.getId(), null, null, false, listed, AccessPath.DIRECT, entity);
    }

    public static MetadataTarget ownedByUser(ResourceClass resourceClass, AbstractMetadataEntity entity, UUID ownerUserId, boolean listed) {
        return new MetadataTarget(resourceClass, entity.getId(), ownerUserId, null, false, listed, AccessPath.DIRECT, entity);
    }

    public static MetadataTarget userAccount(AbstractMetadataEntity user, boolean staff) {
        return new MetadataTarget(ResourceClass.USER, user.getId(), user.getId(), null, staff, true, AccessPath.DIRECT, user);
    }

    public static MetadataTarget app(AbstractMetadataEntity app) {
        return new MetadataTarget(ResourceClass.APP, app.getId(), null, app.getId(), false, true, AccessPath.DIRECT, app);
    }

    public MetadataTarget viaToken() {
        return new MetadataTarget(resourceClass, id, ownerUserId, ownerAppId, staffAccount, listed, AccessPath.TOKEN, entity);
    }

    public boolean isTokenLookup() {
        return accessPath == AccessPath.TOKEN;
    }
}
