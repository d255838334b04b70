package com.vanphong.backend.modules.account.application;

import java.util.Optional;
import java.util.UUID;

import com.vanphong.backend.modules.account.domain.User;
import com.vanphong.backend.modules.account.infrastructure.persistence.UserRepository;
import com.vanphong.backend.modules.metadata.application.MetadataTarget;
import com.vanphong.backend.modules.metadata.application.MetadataTargetProvider;
import com.vanphong.backend.modules.metadata.domain.ResourceClass;

import org.springframework.stereotype.Component;

@Component
public class UserMetadataTargetProvider implements MetadataTargetProvider {

    private final UserRepository userRepository;

    public UserMetadataTargetProvider(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public ResourceClass resourceClass() {
        return ResourceClass.USER;
    }

    @Override
    public Optional<MetadataTarget> findById(UUID id) {
        return userRepository.findById(id).map(this::toTarget);
    }

    @Override
    public Optional<MetadataTarget> findByIdForUpdate(UUID id) {
        return userRepository.findByIdForUpdate(id).map(this::toTarget);
    }

    private MetadataTarget toTarget(User user) {
        return MetadataTarget.userAccount(user, user.isStaff());
    }
}
