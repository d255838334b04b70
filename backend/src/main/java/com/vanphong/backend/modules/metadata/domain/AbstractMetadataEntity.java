package com.vanphong.backend.modules.metadata.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.vanphong.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Base entity for records carrying public {@code metadata} and {@code private_metadata} maps.
 * Mutations replace the map instance so Hibernate dirty checking always sees the change.
 */
@MappedSuperclass
public abstract class AbstractMetadataEntity extends AbstractTimestampedEntity {

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    private Map<String, String> metadata = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "private_metadata", nullable = false, columnDefinition = "jsonb")
    private Map<String, String> privateMetadata = new LinkedHashMap<>();

    public abstract UUID getId();

    public Map<String, String> getMetadata(MetadataPartition partition) {
        Map<String, String> source = partition == MetadataPartition.PRIVATE ? privateMetadata : metadata;
        return source == null ? Map.of() : Collections.unmodifiableMap(source);
    }

    public void storeMetadata(MetadataPartition partition, Map<String, String> items) {
        Map<String, String> updated = new LinkedHashMap<>(getMetadata(partition));
        updated.putAll(items);
        replace(partition, updated);
    }

    /**
     * @return the keys that were present and have been removed
     */
    public Set<String> deleteMetadata(MetadataPartition partition, Collection<String> keys) {
        Map<String, String> updated = new LinkedHashMap<>(getMetadata(partition));
        Set<String> removed = new LinkedHashSet<>();
        for (String key : keys) {
            if (updated.remove(key) != null) {
                removed.add(key);
            }
        }
        if (!removed.isEmpty()) {
            replace(partition, updated);
        }
        return removed;
    }

    private void replace(MetadataPartition partition, Map<String, String> updated) {
        if (partition == MetadataPartition.PRIVATE) {
            this.privateMetadata = updated;
        } else {
            this.metadata = updated;
        }
    }
}
