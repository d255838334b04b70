package com.vanphong.backend.modules.metadata.presentation.dto;

import java.util.List;

import com.vanphong.backend.modules.metadata.application.MetadataEntry;

public record MetadataListResponse(List<MetadataItem> items) {

    public static MetadataListResponse from(List<MetadataEntry> entries) {
        return new MetadataListResponse(entries.stream().map(MetadataItem::from).toList());
    }
}
