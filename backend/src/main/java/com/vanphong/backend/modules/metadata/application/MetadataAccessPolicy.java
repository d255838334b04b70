package com.vanphong.backend.modules.metadata.application;

import static com.vanphong.backend.modules.metadata.application.MetadataAccessRule.catalog;

import java.util.EnumMap;
import java.util.Map;

import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.modules.metadata.application.MetadataAccessRule.Ownership;
import com.vanphong.backend.modules.metadata.application.MetadataAccessRule.PublicRead;
import com.vanphong.backend.modules.metadata.application.MetadataAccessRule.Visibility;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

/**
 * Which requester may read and write which metadata map, per resource class.
 */
@Component
public class MetadataAccessPolicy {

    private final Map<ResourceClass, MetadataAccessRule> rules;

    public MetadataAccessPolicy() {
        Map<ResourceClass, MetadataAccessRule> table = new EnumMap<>(ResourceClass.class);

        table.put(ResourceClass.USER, new MetadataAccessRule(
                Ownership.USER, PublicRead.OWNER_OR_PERMISSION, Visibility.ALWAYS,
                PermissionCode.MANAGE_USERS, PermissionCode.MANAGE_STAFF, false, true));
        table.put(ResourceClass.APP, new MetadataAccessRule(
                Ownership.APP, PublicRead.OWNER_OR_PERMISSION, Visibility.ALWAYS,
                PermissionCode.MANAGE_APPS, null, false, false));
        table.put(ResourceClass.CHECKOUT, new MetadataAccessRule(
                Ownership.USER, PublicRead.EVERYONE, Visibility.UNOWNED_OWNER_OR_PERMISSION,
                PermissionCode.MANAGE_CHECKOUTS, null, false, false));
        table.put(ResourceClass.ORDER, new MetadataAccessRule(
                Ownership.USER, PublicRead.OWNER_OR_PERMISSION, Visibility.LISTED_OWNER_OR_PERMISSION,
                PermissionCode.MANAGE_ORDERS, null, true, false));
        table.put(ResourceClass.FULFILLMENT, new MetadataAccessRule(
                Ownership.USER, PublicRead.OWNER_OR_PERMISSION, Visibility.LISTED_OWNER_OR_PERMISSION,
                PermissionCode.MANAGE_ORDERS, null, true, false));

        table.put(ResourceClass.CATEGORY, catalog(PublicRead.EVERYONE, Visibility.ALWAYS, PermissionCode.MANAGE_ROOMS));
        table.put(ResourceClass.COLLECTION, catalog(PublicRead.EVERYONE, Visibility.LISTED_OR_PERMISSION, PermissionCode.MANAGE_ROOMS));
        table.put(ResourceClass.ATTRIBUTE, catalog(PublicRead.EVERYONE, Visibility.ALWAYS, PermissionCode.MANAGE_ROOM_TYPES_AND_ATTRIBUTES));
        table.put(ResourceClass.ROOM, catalog(PublicRead.EVERYONE, Visibility.LISTED_OR_PERMISSION, PermissionCode.MANAGE_ROOMS));
        table.put(ResourceClass.ROOM_TYPE, catalog(PublicRead.EVERYONE, Visibility.ALWAYS, PermissionCode.MANAGE_ROOM_TYPES_AND_ATTRIBUTES));
        table.put(ResourceClass.ROOM_VARIANT, catalog(PublicRead.EVERYONE, Visibility.LISTED_OR_PERMISSION, PermissionCode.MANAGE_ROOMS));
        table.put(ResourceClass.DIGITAL_CONTENT, catalog(PublicRead.PERMISSION, Visibility.ALWAYS, PermissionCode.MANAGE_ROOMS));
        table.put(ResourceClass.PAGE_TYPE, catalog(PublicRead.EVERYONE, Visibility.ALWAYS, PermissionCode.MANAGE_PAGE_TYPES_AND_ATTRIBUTES));
        table.put(ResourceClass.HOTEL, catalog(PublicRead.PERMISSION, Visibility.ALWAYS, PermissionCode.MANAGE_ROOMS));

        for (ResourceClass resourceClass : ResourceClass.values()) {
            if (!table.containsKey(resourceClass)) {
                throw new IllegalStateException("No metadata access rule for " + resourceClass);
            }
        }
        this.rules = Map.copyOf(table);
    }

    public MetadataAccessRule ruleFor(ResourceClass resourceClass) {
        return rules.get(resourceClass);
    }
}
