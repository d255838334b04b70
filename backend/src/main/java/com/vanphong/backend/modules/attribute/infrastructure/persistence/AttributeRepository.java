package com.vanphong.backend.modules.attribute.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.attribute.domain.Attribute;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AttributeRepository extends JpaRepository<Attribute, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Attribute a where a.id = :id")
    Optional<Attribute> findByIdForUpdate(@Param("id") UUID id);
}
