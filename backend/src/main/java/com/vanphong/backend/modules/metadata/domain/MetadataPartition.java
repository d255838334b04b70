package com.vanphong.backend.modules.metadata.domain;

/**
 * The two key/value maps carried by every metadata-bearing record.
 */
public enum MetadataPartition {
    PUBLIC("metadata"),
    PRIVATE("private-metadata");

    private final String pathSegment;

    MetadataPartition(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }
}
