package com.vanphong.backend.modules.checkout.domain;

import java.util.UUID;

import com.vanphong.backend.modules.account.domain.User;
import com.vanphong.backend.modules.metadata.domain.AbstractMetadataEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Shopping session identified by its token. Guest checkouts have no user.
 */
@Entity
@Table(name = "checkout")
public class Checkout extends AbstractMetadataEntity {

    @Id
    @UuidGenerator
    @Column(name = "token", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID token;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private User user;

    @Column(name = "email", length = 320)
    private String email;

    @Override
    public UUID getId() {
        return token;
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

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
