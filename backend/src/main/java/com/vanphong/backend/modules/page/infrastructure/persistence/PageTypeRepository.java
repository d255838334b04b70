package com.vanphong.backend.modules.page.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.page.domain.PageType;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PageTypeRepository extends JpaRepository<PageType, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PageType p where p.id = :id")
    Optional<PageType> findByIdForUpdate(@Param("id") UUID id);
}
