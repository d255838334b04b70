package com.vanphong.backend.modules.order.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.vanphong.backend.modules.account.domain.User;
import com.vanphong.backend.modules.metadata.domain.AbstractMetadataEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity(name = "ShopOrder")
@Table(name = "shop_order")
public class Order extends AbstractMetadataEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "token", nullable = false, unique = true, updatable = false, columnDefinition = "uuid")
    private UUID token = UUID.randomUUID();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    @Column(name = "user_email", length = 320)
    private String userEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OrderStatus status = OrderStatus.UNFULFILLED;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("fulfillmentOrder ASC")
    private List<Fulfillment> fulfillments = new ArrayList<>();

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getToken() {
        return token;
    }

    public User getUser() {
        return user;
    }

    public void setUser(User user) {
        this.user = user;
    }

    public UUID getUserId() {
        return user == null ? null : user.getId();
    }

    public String getUserEmail() {
        return userEmail;
    }

    public void setUserEmail(String userEmail) {
        this.userEmail = userEmail;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    public boolean isDraft() {
        return status == OrderStatus.DRAFT;
    }

    public List<Fulfillment> getFulfillments() {
        return fulfillments;
    }

    public Fulfillment addFulfillment(FulfillmentStatus fulfillmentStatus) {
        Fulfillment fulfillment = new Fulfillment();
        fulfillment.setOrder(this);
        fulfillment.setFulfillmentOrder(fulfillments.size() + 1);
        fulfillment.setStatus(fulfillmentStatus);
        fulfillments.add(fulfillment);
        return fulfillment;
    }
}
