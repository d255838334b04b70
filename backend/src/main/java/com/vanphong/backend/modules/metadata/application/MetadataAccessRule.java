package com.vanphong.backend.modules.metadata.application;

import java.util.Objects;

import com.vanphong.backend.global.security.PermissionCode;

/**
 * One row of the metadata access policy.
 *
 * @param managingPermission    permission gating private reads and all writes
 * @param staffPermission       replaces {@code managingPermission} when the target is a staff account
 * @param tokenGrantsPublicRead whether a token lookup grants public reads
 * @param staffHiddenFromApps   apps are denied outright on staff account targets
 */
public record MetadataAccessRule(
        Ownership ownership,
        PublicRead publicRead,
        Visibility visibility,
        PermissionCode managingPermission,
        PermissionCode staffPermission,
        boolean tokenGrantsPublicRead,
        boolean staffHiddenFromApps
) {

    public enum Ownership {
        NONE,
        USER,
        APP
    }

    public enum PublicRead {
        EVERYONE,
        OWNER_OR_PERMISSION,
        PERMISSION
    }

    /** Decides whether a requester may learn the record exists at all. */
    public enum Visibility {
        ALWAYS,
        LISTED_OR_PERMISSION,
        LISTED_OWNER_OR_PERMISSION,
        UNOWNED_OWNER_OR_PERMISSION
    }

    public MetadataAccessRule {
        Objects.requireNonNull(ownership, "ownership is required");
        Objects.requireNonNull(publicRead, "publicRead is required");
        Objects.requireNonNull(visibility, "visibility is required");
        Objects.requireNonNull(managingPermission, "managingPermission is required");
    }

    public static MetadataAccessRule catalog(PublicRead publicRead, Visibility visibility, PermissionCode permission) {
        return new MetadataAccessRule(Ownership.NONE, publicRead, visibility, permission, null, false, false);
    }

    public PermissionCode requiredPermission(MetadataTarget target) {
        if (target.staffAccount() && staffPermission != null) {
            return staffPermission;
        }
        return managingPermission;
    }
}
