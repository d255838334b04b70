package com.vanphong.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.catalog.domain.RoomType;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoomTypeRepository extends JpaRepository<RoomType, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from RoomType t where t.id = :id")
    Optional<RoomType> findByIdForUpdate(@Param("id") UUID id);
}
