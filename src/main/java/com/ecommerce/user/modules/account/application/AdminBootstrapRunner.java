package com.ecommerce.user.modules.account.application;

import com.ecommerce.user.global.config.BootstrapAdminProperties;
import com.ecommerce.user.modules.account.domain.EmailAddresses;
import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.modules.account.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the configured staff account when it does not exist yet. An existing account is left untouched.
 */
@Component
public class AdminBootstrapRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapRunner.class);

    private final BootstrapAdminProperties properties;
    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;

    public AdminBootstrapRunner(
            BootstrapAdminProperties properties,
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.properties = properties;
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!properties.isConfigured()) {
            return;
        }
        String email = EmailAddresses.normalize(properties.email());
        if (userAccountRepository.existsByEmail(email)) {
            log.debug("Bootstrap staff account {} already exists", email);
            return;
        }
        UserAccount admin = new UserAccount();
        admin.setEmail(email);
        admin.setPasswordHash(passwordEncoder.encode(properties.password()));
        admin.setActive(true);
        admin.setStaff(true);
        admin.setVerified(true);
        userAccountRepository.save(admin);
        log.info("Bootstrap staff account created: {}", email);
    }
}
