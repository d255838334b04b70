package com.vanphong.backend.modules.metadata.presentation;

import java.util.List;
import java.util.UUID;

import com.vanphong.backend.global.security.SecurityUtils;
import com.vanphong.backend.modules.metadata.application.MetadataService;
import com.vanphong.backend.modules.metadata.application.ResourceNotFoundException;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;
import com.vanphong.backend.modules.metadata.presentation.dto.MetadataListResponse;
import com.vanphong.backend.modules.metadata.presentation.dto.UpdateMetadataRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MetadataController {

    private final MetadataService metadataService;

    public MetadataController(MetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @Operation(summary = "Public metadata of a record")
    @GetMapping("/{resource}/{id}/metadata")
    public ResponseEntity<MetadataListResponse> getMetadata(
            @Parameter(description = "Resource path segment, e.g. users, checkouts, rooms")
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.get(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PUBLIC)));
    }

    @Operation(summary = "Private metadata of a record", description = "Requires the permission managing the resource class.")
    @GetMapping("/{resource}/{id}/private-metadata")
    public ResponseEntity<MetadataListResponse> getPrivateMetadata(
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.get(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PRIVATE)));
    }

    @Operation(summary = "Store or update public metadata keys")
    @PatchMapping("/{resource}/{id}/metadata")
    public ResponseEntity<MetadataListResponse> updateMetadata(
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateMetadataRequest request
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.update(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PUBLIC, request.toMap())));
    }

    @Operation(summary = "Store or update private metadata keys")
    @PatchMapping("/{resource}/{id}/private-metadata")
    public ResponseEntity<MetadataListResponse> updatePrivateMetadata(
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateMetadataRequest request
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.update(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PRIVATE, request.toMap())));
    }

    @Operation(summary = "Delete public metadata keys")
    @DeleteMapping("/{resource}/{id}/metadata")
    public ResponseEntity<MetadataListResponse> deleteMetadata(
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id,
            @RequestParam("keys") List<String> keys
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.delete(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PUBLIC, keys)));
    }

    @Operation(summary = "Delete private metadata keys")
    @DeleteMapping("/{resource}/{id}/private-metadata")
    public ResponseEntity<MetadataListResponse> deletePrivateMetadata(
            @PathVariable("resource") String resource,
            @PathVariable("id") UUID id,
            @RequestParam("keys") List<String> keys
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.delete(
                SecurityUtils.currentRequester(), resolve(resource), id, MetadataPartition.PRIVATE, keys)));
    }

    @Operation(summary = "Public metadata of the current user")
    @GetMapping("/me/metadata")
    public ResponseEntity<MetadataListResponse> getMyMetadata() {
        return ResponseEntity.ok(MetadataListResponse.from(
                metadataService.me(SecurityUtils.currentRequester(), MetadataPartition.PUBLIC)));
    }

    @Operation(summary = "Private metadata of the current user", description = "Staff need MANAGE_STAFF, customers are always denied.")
    @GetMapping("/me/private-metadata")
    public ResponseEntity<MetadataListResponse> getMyPrivateMetadata() {
        return ResponseEntity.ok(MetadataListResponse.from(
                metadataService.me(SecurityUtils.currentRequester(), MetadataPartition.PRIVATE)));
    }

    private static ResourceClass resolve(String resource) {
        return ResourceClass.fromPathSegment(resource)
                .orElseThrow(() -> ResourceNotFoundException.unknownResource(resource));
    }
}
