package com.ecommerce.user.modules.account.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.ecommerce.user.modules.account.domain.EmailAddresses;
import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.modules.account.infrastructure.persistence.UserAccountRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only view of the account store used by the lookup service and the admin listing.
 * Direct lookups include inactive accounts; listings only return active ones.
 */
@Service
@Transactional(readOnly = true)
public class UserDirectory {

    private final UserAccountRepository userAccountRepository;

    public UserDirectory(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    public Optional<UserAccount> findById(UUID id) {
        return userAccountRepository.findById(id);
    }

    public Optional<UserAccount> findByEmail(String email) {
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return userAccountRepository.findByEmail(normalized);
    }

    public long countActive() {
        return userAccountRepository.countByActiveTrue();
    }

    public List<UserAccount> listActive(long offset, int limit) {
        return userAccountRepository.findActiveWindow(offset, limit);
    }
}
