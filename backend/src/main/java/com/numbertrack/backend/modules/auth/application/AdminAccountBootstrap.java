package com.numbertrack.backend.modules.auth.application;

import com.numbertrack.backend.modules.auth.domain.AdminUser;
import com.numbertrack.backend.modules.auth.infrastructure.persistence.AdminUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first administrator account from {@code app.auth.bootstrap-admin.*}
 * when the admin table is still empty. Does nothing once any account exists.
 */
@Component
public class AdminAccountBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountBootstrap.class);

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final String username;
    private final String password;
    private final String employeeBusinessId;

    public AdminAccountBootstrap(
            AdminUserRepository adminUserRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.auth.bootstrap-admin.username:}") String username,
            @Value("${app.auth.bootstrap-admin.password:}") String password,
            @Value("${app.auth.bootstrap-admin.employee-id:}") String employeeBusinessId
    ) {
        this.adminUserRepository = adminUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.username = username;
        this.password = password;
        this.employeeBusinessId = employeeBusinessId;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void createInitialAdmin() {
        if (!StringUtils.hasText(username) || !StringUtils.hasText(password)) {
            return;
        }
        if (adminUserRepository.count() > 0) {
            return;
        }
        AdminUser admin = new AdminUser();
        admin.setUsername(username.trim());
        admin.setPasswordHash(passwordEncoder.encode(password));
        admin.setEmployeeBusinessId(StringUtils.hasText(employeeBusinessId) ? employeeBusinessId.trim() : null);
        adminUserRepository.save(admin);
        log.warn("[ALERT][BOOTSTRAP] initial admin account '{}' created; change its password", admin.getUsername());
    }
}
