package com.vanphong.backend.modules.checkout.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.checkout.domain.Checkout;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CheckoutRepository extends JpaRepository<Checkout, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Checkout c where c.token = :token")
    Optional<Checkout> findByIdForUpdate(@Param("token") UUID token);
}
