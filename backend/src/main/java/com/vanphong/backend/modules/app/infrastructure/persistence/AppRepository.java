package com.vanphong.backend.modules.app.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.app.domain.App;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppRepository extends JpaRepository<App, UUID> {

    Optional<App> findByTokenHash(String tokenHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from App a where a.id = :id")
    Optional<App> findByIdForUpdate(@Param("id") UUID id);
}
