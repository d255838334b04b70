package com.vanphong.backend.modules.metadata.presentation;

import java.util.UUID;

import com.vanphong.backend.global.security.SecurityUtils;
import com.vanphong.backend.modules.metadata.application.MetadataService;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;
import com.vanphong.backend.modules.metadata.presentation.dto.MetadataListResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order and fulfillment metadata looked up through the order token. Holding the token opens the
 * public map; private metadata still needs MANAGE_ORDERS.
 */
@RestController
@RequestMapping("/orders/by-token/{token}")
public class OrderTokenMetadataController {

    private final MetadataService metadataService;

    public OrderTokenMetadataController(MetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @Operation(summary = "Public metadata of an order looked up by token")
    @GetMapping("/metadata")
    public ResponseEntity<MetadataListResponse> getOrderMetadata(@PathVariable("token") UUID token) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.getOrderByToken(
                SecurityUtils.currentRequester(), token, MetadataPartition.PUBLIC)));
    }

    @Operation(summary = "Private metadata of an order looked up by token")
    @GetMapping("/private-metadata")
    public ResponseEntity<MetadataListResponse> getOrderPrivateMetadata(@PathVariable("token") UUID token) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.getOrderByToken(
                SecurityUtils.currentRequester(), token, MetadataPartition.PRIVATE)));
    }

    @Operation(summary = "Public metadata of a fulfillment of an order looked up by token")
    @GetMapping("/fulfillments/{fulfillmentId}/metadata")
    public ResponseEntity<MetadataListResponse> getFulfillmentMetadata(
            @PathVariable("token") UUID token,
            @PathVariable("fulfillmentId") UUID fulfillmentId
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.getFulfillmentByOrderToken(
                SecurityUtils.currentRequester(), token, fulfillmentId, MetadataPartition.PUBLIC)));
    }

    @Operation(summary = "Private metadata of a fulfillment of an order looked up by token")
    @GetMapping("/fulfillments/{fulfillmentId}/private-metadata")
    public ResponseEntity<MetadataListResponse> getFulfillmentPrivateMetadata(
            @PathVariable("token") UUID token,
            @PathVariable("fulfillmentId") UUID fulfillmentId
    ) {
        return ResponseEntity.ok(MetadataListResponse.from(metadataService.getFulfillmentByOrderToken(
                SecurityUtils.currentRequester(), token, fulfillmentId, MetadataPartition.PRIVATE)));
    }
}
