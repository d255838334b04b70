package com.vanphong.backend.modules.metadata.presentation.dto;

import com.vanphong.backend.modules.metadata.application.MetadataEntry;

import jakarta.validation.constraints.NotNull;

public record MetadataItem(
        @NotNull(message = "key is required") String key,
        @NotNull(message = "value is required") String value
) {

    public static MetadataItem from(MetadataEntry entry) {
        return new MetadataItem(entry.key(), entry.value());
    }
}
