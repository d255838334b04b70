package com.vanphong.backend.modules.order.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.order.domain.Fulfillment;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FulfillmentRepository extends JpaRepository<Fulfillment, UUID> {

    @Query("""
            select f
              from Fulfillment f
              join fetch f.order o
             where f.id = :id
            """)
    Optional<Fulfillment> findWithOrderById(@Param("id") UUID id);

    @Query("""
            select f
              from Fulfillment f
              join fetch f.order o
             where f.id = :id
               and o.token = :token
            """)
    Optional<Fulfillment> findByIdAndOrderToken(@Param("id") UUID id, @Param("token") UUID token);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from Fulfillment f join fetch f.order o where f.id = :id")
    Optional<Fulfillment> findByIdForUpdate(@Param("id") UUID id);
}
