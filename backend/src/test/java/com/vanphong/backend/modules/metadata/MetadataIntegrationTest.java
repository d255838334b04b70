package com.vanphong.backend.modules.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.vanphong.backend.global.security.PermissionCode;
import com.vanphong.backend.modules.account.domain.User;
import com.vanphong.backend.modules.app.domain.App;
import com.vanphong.backend.modules.audit.domain.AuditLog;
import com.vanphong.backend.modules.audit.infrastructure.AuditLogRepository;
import com.vanphong.backend.modules.catalog.domain.Category;
import com.vanphong.backend.modules.catalog.domain.Room;
import com.vanphong.backend.modules.checkout.domain.Checkout;
import com.vanphong.backend.modules.hotel.domain.Hotel;
import com.vanphong.backend.modules.metadata.domain.MetadataPartition;
import com.vanphong.backend.modules.order.domain.Order;
import com.vanphong.backend.modules.order.domain.OrderStatus;
import com.vanphong.backend.modules.order.infrastructure.persistence.OrderRepository;
import com.vanphong.backend.support.AbstractPostgresIntegrationTest;
import com.vanphong.backend.support.TestFixtures;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@AutoConfigureMockMvc
class MetadataIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestFixtures fixtures;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    void anonymousLookupOfAnotherCustomersCheckoutIsNotFound() throws Exception {
        User owner = fixtures.customer("owner@vanphong.test");
        Checkout checkout = fixtures.checkout(owner);
        fixtures.putCheckoutMetadata(checkout.getToken(), MetadataPartition.PUBLIC, Map.of("note", "late arrival"));

        mockMvc.perform(get("/checkouts/{token}/metadata", checkout.getToken()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("checkout_not_found"));

        mockMvc.perform(get("/checkouts/{token}/metadata", checkout.getToken())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(owner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("note"))
                .andExpect(jsonPath("$.items[0].value").value("late arrival"));
    }

    @Test
    void staffWithoutManageCheckoutsGetsNotFoundForForeignCheckout() throws Exception {
        Checkout checkout = fixtures.checkout(fixtures.customer("owner@vanphong.test"));
        User orders = fixtures.staff("orders@vanphong.test", PermissionCode.MANAGE_ORDERS);
        User checkouts = fixtures.staff("checkouts@vanphong.test", PermissionCode.MANAGE_CHECKOUTS);

        mockMvc.perform(get("/checkouts/{token}/private-metadata", checkout.getToken())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(orders)))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/checkouts/{token}/private-metadata", checkout.getToken())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(checkouts)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    void staffPrivateMetadataNeedsManageStaff() throws Exception {
        User target = fixtures.staff("target@vanphong.test");
        fixtures.putUserMetadata(target.getId(), MetadataPartition.PRIVATE, Map.of("payroll", "B2"));
        User staffManager = fixtures.staff("hr@vanphong.test", PermissionCode.MANAGE_STAFF);
        User userManager = fixtures.staff("support@vanphong.test", PermissionCode.MANAGE_USERS);

        mockMvc.perform(get("/users/{id}/private-metadata", target.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(staffManager)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("payroll"));

        mockMvc.perform(get("/users/{id}/private-metadata", target.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(userManager)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("permission_denied"));
    }

    @Test
    void appWithEveryPermissionCannotReadStaffAccount() throws Exception {
        User target = fixtures.staff("target@vanphong.test");
        App app = fixtures.app("integrator", "raw-token", PermissionCode.values());

        mockMvc.perform(get("/users/{id}/metadata", target.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(app)))
                .andExpect(status().isForbidden());
    }

    @Test
    void meExposesPublicMetadataButNotPrivateToCustomer() throws Exception {
        User customer = fixtures.customer("me@vanphong.test");
        fixtures.putUserMetadata(customer.getId(), MetadataPartition.PUBLIC, Map.of("b", "2", "a", "1"));
        fixtures.putUserMetadata(customer.getId(), MetadataPartition.PRIVATE, Map.of("risk", "low"));
        String bearer = fixtures.bearer(customer);

        mockMvc.perform(get("/me/metadata").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("a"))
                .andExpect(jsonPath("$.items[1].key").value("b"));

        mockMvc.perform(get("/me/private-metadata").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/me/metadata"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void patchThenReadCategoryMetadataAndAudit() throws Exception {
        Category category = fixtures.category("suites");
        User manager = fixtures.staff("catalog@vanphong.test", PermissionCode.MANAGE_ROOMS);

        mockMvc.perform(patch("/categories/{id}/private-metadata", category.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"key": "supplier", "value": "acme"}, {"key": "margin", "value": "12"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("margin"))
                .andExpect(jsonPath("$.items[1].key").value("supplier"));

        mockMvc.perform(get("/categories/{id}/private-metadata", category.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(manager)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2));

        mockMvc.perform(get("/categories/{id}/private-metadata", category.getId()))
                .andExpect(status().isForbidden());

        List<AuditLog> audit = auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(
                "CATEGORY", category.getId().toString());
        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).getActionType()).isEqualTo("METADATA_UPDATE");
        assertThat(audit.get(0).getActorId()).isEqualTo(manager.getId());
    }

    @Test
    void deleteRemovesRequestedKeys() throws Exception {
        User customer = fixtures.customer("me@vanphong.test");
        fixtures.putUserMetadata(customer.getId(), MetadataPartition.PUBLIC, Map.of("keep", "1", "drop", "2"));

        mockMvc.perform(delete("/users/{id}/metadata", customer.getId())
                        .param("keys", "drop")
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(customer)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].key").value("keep"));
    }

    @Test
    void mutationsRequireAuthentication() throws Exception {
        Category category = fixtures.category("villas");

        mockMvc.perform(patch("/categories/{id}/metadata", category.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"key\": \"k\", \"value\": \"v\"}]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void blankKeyIsRejected() throws Exception {
        Category category = fixtures.category("lofts");
        User manager = fixtures.staff("catalog@vanphong.test", PermissionCode.MANAGE_ROOMS);

        mockMvc.perform(patch("/categories/{id}/metadata", category.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"key\": \" \", \"value\": \"v\"}]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("metadata_key_required"));
    }

    @Test
    void unpublishedRoomIsNotFoundForAnonymous() throws Exception {
        Room hidden = fixtures.room("draft-room", false);
        Room listed = fixtures.room("sea-view", true);

        mockMvc.perform(get("/rooms/{id}/metadata", hidden.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("room_not_found"));
        mockMvc.perform(get("/rooms/{id}/metadata", listed.getId()))
                .andExpect(status().isOk());
    }

    @Test
    void hotelMetadataIsStaffOnly() throws Exception {
        Hotel hotel = fixtures.hotel("riverside");

        mockMvc.perform(get("/hotels/{id}/metadata", hotel.getId()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/hotels/{id}/metadata", hotel.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(fixtures.staff("ops@vanphong.test", PermissionCode.MANAGE_ROOMS))))
                .andExpect(status().isOk());
    }

    @Test
    void orderTokenOpensPublicMetadataOfOrderAndFulfillment() throws Exception {
        User owner = fixtures.customer("buyer@vanphong.test");
        Order order = fixtures.order(owner, OrderStatus.UNFULFILLED, true);
        fixtures.putOrderMetadata(order.getId(), MetadataPartition.PUBLIC, Map.of("gift", "yes"));
        UUID fulfillmentId = transactionTemplate.execute(status ->
                orderRepository.findById(order.getId()).orElseThrow().getFulfillments().get(0).getId());

        mockMvc.perform(get("/orders/by-token/{token}/metadata", order.getToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].value").value("yes"));
        mockMvc.perform(get("/orders/by-token/{token}/private-metadata", order.getToken()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/orders/by-token/{token}/fulfillments/{id}/metadata", order.getToken(), fulfillmentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("gift"));
        mockMvc.perform(get("/orders/{id}/metadata", order.getId()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/orders/by-token/{token}/metadata", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("order_not_found"));
    }

    @Test
    void draftOrderTokenIsNotFoundWithoutManageOrders() throws Exception {
        Order draft = fixtures.order(null, OrderStatus.DRAFT, false);

        mockMvc.perform(get("/orders/by-token/{token}/metadata", draft.getToken()))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/orders/by-token/{token}/private-metadata", draft.getToken())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(fixtures.staff("orders@vanphong.test", PermissionCode.MANAGE_ORDERS))))
                .andExpect(status().isOk());
    }

    @Test
    void concurrentPatchesOfDifferentKeysAreAllKept() throws Exception {
        Category category = fixtures.category("penthouses");
        String bearer = fixtures.bearer(fixtures.staff("catalog@vanphong.test", PermissionCode.MANAGE_ROOMS));
        int writers = 6;

        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch ready = new CountDownLatch(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MockHttpServletResponse>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String key = "key-" + i;
            Callable<MockHttpServletResponse> task = () -> {
                ready.countDown();
                boolean started = start.await(5, TimeUnit.SECONDS);
                assertThat(started).isTrue();
                return mockMvc.perform(patch("/categories/{id}/metadata", category.getId())
                                .header(HttpHeaders.AUTHORIZATION, bearer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"items\": [{\"key\": \"%s\", \"value\": \"v\"}]}".formatted(key)))
                        .andReturn()
                        .getResponse();
            };
            results.add(executor.submit(task));
        }

        try {
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();
            for (Future<MockHttpServletResponse> result : results) {
                assertThat(result.get(20, TimeUnit.SECONDS).getStatus()).isEqualTo(200);
            }
        } finally {
            executor.shutdownNow();
        }

        mockMvc.perform(get("/categories/{id}/metadata", category.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(writers));
        assertThat(auditLogRepository.findByResourceTypeAndResourceKeyOrderByCreatedAtAsc(
                "CATEGORY", category.getId().toString())).hasSize(writers);
    }

    @Test
    void draftOrderOwnerReadsAndWritesPublicMetadataById() throws Exception {
        User owner = fixtures.customer("drafter@vanphong.test");
        Order draft = fixtures.order(owner, OrderStatus.DRAFT, false);
        String bearer = fixtures.bearer(owner);

        mockMvc.perform(patch("/orders/{id}/metadata", draft.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [{\"key\": \"gift-wrap\", \"value\": \"yes\"}]}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/orders/{id}/metadata", draft.getId()).header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].key").value("gift-wrap"));
        mockMvc.perform(get("/orders/{id}/private-metadata", draft.getId()).header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/orders/{id}/metadata", draft.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(fixtures.customer("other@vanphong.test"))))
                .andExpect(status().isNotFound());
    }

    @Test
    void nullItemInPatchIsValidationError() throws Exception {
        Category category = fixtures.category("bungalows");
        User manager = fixtures.staff("catalog@vanphong.test", PermissionCode.MANAGE_ROOMS);

        mockMvc.perform(patch("/categories/{id}/metadata", category.getId())
                        .header(HttpHeaders.AUTHORIZATION, fixtures.bearer(manager))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\": [null]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void unknownResourceSegmentIsNotFound() throws Exception {
        mockMvc.perform(get("/products/{id}/metadata", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("resource_not_found"));
    }

    @Test
    void invalidBearerTokenIsUnauthorized() throws Exception {
        Category category = fixtures.category("cabins");

        mockMvc.perform(get("/categories/{id}/metadata", category.getId())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized());
    }
}
