package com.vanphong.backend.modules.metadata.application;

public record MetadataEntry(String key, String value) {
}
