package com.vanphong.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.catalog.domain.DigitalContent;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DigitalContentRepository extends JpaRepository<DigitalContent, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from DigitalContent d where d.id = :id")
    Optional<DigitalContent> findByIdForUpdate(@Param("id") UUID id);
}
