package com.vanphong.backend.modules.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.junit.jupiter.api.Test;

class ResourceClassTest {

    @Test
    void resolvesPathSegments() {
        assertThat(ResourceClass.fromPathSegment("room-variants")).contains(ResourceClass.ROOM_VARIANT);
        assertThat(ResourceClass.fromPathSegment(" Checkouts ")).contains(ResourceClass.CHECKOUT);
        assertThat(ResourceClass.fromPathSegment("products")).isEmpty();
        assertThat(ResourceClass.fromPathSegment(null)).isEmpty();
    }

    @Test
    void notFoundCodeUsesResourceName() {
        assertThat(ResourceClass.CHECKOUT.notFoundCode()).isEqualTo("checkout_not_found");
        assertThat(ResourceClass.PAGE_TYPE.notFoundCode()).isEqualTo("page_type_not_found");
    }
}
