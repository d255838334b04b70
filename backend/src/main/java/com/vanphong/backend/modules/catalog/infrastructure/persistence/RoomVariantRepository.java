package com.vanphong.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.catalog.domain.RoomVariant;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoomVariantRepository extends JpaRepository<RoomVariant, UUID> {

    @Query("""
            select v
              from RoomVariant v
              join fetch v.room r
             where v.id = :id
            """)
    Optional<RoomVariant> findWithRoomById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from RoomVariant v join fetch v.room r where v.id = :id")
    Optional<RoomVariant> findByIdForUpdate(@Param("id") UUID id);
}
