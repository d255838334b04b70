package com.vanphong.backend.modules.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.vanphong.backend.global.error.RestExceptionHandler;
import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.global.security.Requester;
import com.vanphong.backend.global.security.RequesterKind;
import com.vanphong.backend.global.security.RestAccessDeniedHandler;
import com.vanphong.backend.global.security.RestAuthenticationEntryPoint;
import com.vanphong.backend.global.security.SecurityConfig;
import com.vanphong.backend.global.web.RequestIdFilter;
import com.vanphong.backend.modules.auth.application.JwtTokenService;
import com.vanphong.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.vanphong.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.vanphong.backend.modules.metadata.application.MetadataEntry;
import com.vanphong.backend.modules.metadata.application.MetadataService;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;
import com.vanphong.backend.modules.metadata.presentation.MetadataController;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = MetadataController.class)
@Import({
        SecurityConfig.class,
        RestAuthenticationEntryPoint.class,
        RestAccessDeniedHandler.class,
        RestExceptionHandler.class
})
class MetadataControllerTest {

    private static final String STAFF_TOKEN = "staff-token";
    private static final String CUSTOMER_TOKEN = "customer-token";
    private static final String APP_TOKEN = "app-token";
    private static final String BROKEN_TOKEN = "broken-token";

    private static final UUID STAFF_ID = UUID.randomUUID();
    private static final UUID CUSTOMER_ID = UUID.randomUUID();
    private static final UUID APP_ID = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetadataService metadataService;

    @MockBean
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUpTokens() {
        when(jwtTokenService.parseAccessToken(STAFF_TOKEN))
                .thenReturn(parsed(STAFF_ID, RequesterKind.STAFF, EnumSet.of(PermissionCode.MANAGE_ROOMS)));
        when(jwtTokenService.parseAccessToken(CUSTOMER_TOKEN))
                .thenReturn(parsed(CUSTOMER_ID, RequesterKind.CUSTOMER, Set.of()));
        when(jwtTokenService.parseAccessToken(APP_TOKEN))
                .thenReturn(parsed(APP_ID, RequesterKind.APP, EnumSet.of(PermissionCode.MANAGE_USERS)));
        when(jwtTokenService.parseAccessToken(BROKEN_TOKEN))
                .thenThrow(new InvalidTokenException("Invalid access token", null));
    }

    @Test
    @DisplayName("anonymous GET reaches the service as the anonymous requester")
    void anonymousReadIsPassedThrough() throws Exception {
        UUID id = UUID.randomUUID();
        when(metadataService.get(Requester.anonymous(), ResourceClass.CATEGORY, id, MetadataPartition.PUBLIC))
                .thenReturn(List.of(new MetadataEntry("color", "teal")));

        mockMvc.perform(get("/categories/{id}/metadata", id))
                .andExpect(status().isOk())
                .andExpect(header().exists(RequestIdFilter.REQUEST_ID_HEADER))
                .andExpect(jsonPath("$.items[0].key").value("color"))
                .andExpect(jsonPath("$.items[0].value").value("teal"));
    }

    @Test
    void patchWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(patch("/categories/{id}/metadata", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"key\": \"k\", \"value\": \"v\"}]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"vanphong\""))
                .andExpect(jsonPath("$.code").value("unauthorized"));

        verifyNoInteractions(metadataService);
    }

    @Test
    void deleteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(delete("/categories/{id}/private-metadata", UUID.randomUUID()).param("keys", "k"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(metadataService);
    }

    @Test
    void rejectedBearerTokenIsUnauthorizedEvenForReads() throws Exception {
        mockMvc.perform(get("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + BROKEN_TOKEN))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE,
                        "Bearer realm=\"vanphong\", error=\"invalid_token\""))
                .andExpect(jsonPath("$.code").value("unauthorized"))
                .andExpect(jsonPath("$.detail").value("The bearer access token is invalid or expired"));

        verifyNoInteractions(metadataService);
    }

    @Test
    @DisplayName("/me needs a user token: anonymous is 401, an app is 403")
    void meIsLimitedToUsers() throws Exception {
        mockMvc.perform(get("/me/metadata"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/me/private-metadata").header(HttpHeaders.AUTHORIZATION, "Bearer " + APP_TOKEN))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("permission_denied"));

        when(metadataService.me(Requester.customer(CUSTOMER_ID), MetadataPartition.PUBLIC))
                .thenReturn(List.of());
        mockMvc.perform(get("/me/metadata").header(HttpHeaders.AUTHORIZATION, "Bearer " + CUSTOMER_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    void unknownResourceSegmentIsNotFound() throws Exception {
        mockMvc.perform(get("/products/{id}/metadata", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("resource_not_found"));

        verifyNoInteractions(metadataService);
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/categories/{id}/metadata", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }

    @Test
    @DisplayName("a null entry in items is a validation error, not a server error")
    void nullItemIsRejected() throws Exception {
        mockMvc.perform(patch("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [null]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));

        verifyNoInteractions(metadataService);
    }

    @Test
    void emptyItemsAndMissingValueAreRejected() throws Exception {
        mockMvc.perform(patch("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": []}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));

        mockMvc.perform(patch("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"key\": \"k\"}]}"))
                .andExpect(status().isUnprocessableEntity());

        verifyNoInteractions(metadataService);
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mockMvc.perform(patch("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }

    @Test
    void deleteWithoutKeysIsBadRequest() throws Exception {
        mockMvc.perform(delete("/categories/{id}/metadata", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(metadataService);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("PATCH hands the token's requester and the item map to the service")
    void patchPassesRequesterAndItems() throws Exception {
        UUID id = UUID.randomUUID();
        when(metadataService.update(any(), eq(ResourceClass.ROOM), eq(id), eq(MetadataPartition.PRIVATE), anyMap()))
                .thenReturn(List.of(new MetadataEntry("supplier", "globex")));

        mockMvc.perform(patch("/rooms/{id}/private-metadata", id)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + STAFF_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"key": "supplier", "value": "acme"}, {"key": "supplier", "value": "globex"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].value").value("globex"));

        ArgumentCaptor<Requester> requester = ArgumentCaptor.forClass(Requester.class);
        ArgumentCaptor<Map<String, String>> items = ArgumentCaptor.forClass(Map.class);
        verify(metadataService).update(requester.capture(), eq(ResourceClass.ROOM), eq(id),
                eq(MetadataPartition.PRIVATE), items.capture());
        assertThat(requester.getValue()).isEqualTo(Requester.staff(STAFF_ID, EnumSet.of(PermissionCode.MANAGE_ROOMS)));
        assertThat(items.getValue()).containsExactly(Map.entry("supplier", "globex"));
    }

    private static ParsedToken parsed(UUID subjectId, RequesterKind kind, Set<PermissionCode> permissions) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return new ParsedToken(subjectId, kind, permissions, now, now.plusMinutes(15));
    }
}
