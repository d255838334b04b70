package com.vanphong.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.catalog.domain.RoomCollection;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoomCollectionRepository extends JpaRepository<RoomCollection, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from RoomCollection c where c.id = :id")
    Optional<RoomCollection> findByIdForUpdate(@Param("id") UUID id);
}
