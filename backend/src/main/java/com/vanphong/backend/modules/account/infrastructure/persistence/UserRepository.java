package com.vanphong.backend.modules.account.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.account.domain.User;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, UUID> {

    @Query("select u from AccountUser u where lower(u.email) = lower(:email)")
    Optional<User> findByEmailIgnoreCase(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AccountUser u where u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") UUID id);
}
