package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.user.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Resolves recipients from the active users in the directory.
 */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DirectoryRecipientResolver implements RecipientResolver {

    private final AppUserRepository userRepository;

    @Override
    public List<UUID> admins() {
        return withRole(Role.ADMIN);
    }

    @Override
    public List<UUID> withRole(Role role) {
        return userRepository.findActiveIdsByRole(role);
    }

    @Override
    public List<UUID> everyone() {
        return userRepository.findActiveIds();
    }
}
