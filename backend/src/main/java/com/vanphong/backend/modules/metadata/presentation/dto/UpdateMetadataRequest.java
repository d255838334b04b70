package com.vanphong.backend.modules.metadata.presentation.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record UpdateMetadataRequest(
        @NotEmpty(message = "items must not be empty") List<@NotNull(message = "items must not contain null") @Valid MetadataItem> items
) {

    /** Later items win when a key repeats. */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        items.forEach(item -> map.put(item.key(), item.value()));
        return map;
    }
}
