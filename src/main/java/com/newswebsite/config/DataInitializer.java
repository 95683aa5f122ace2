package com.newswebsite.config;

import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import com.newswebsite.repository.UserRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Seeds a verified ADMIN so a fresh database has someone who can create the other users.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger LOG = LogManager.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner seedAdmin(UserRepository userRepository, PasswordEncoder passwordEncoder,
                                AppProperties appProperties) {
        return args -> {
            AppProperties.Seed seed = appProperties.getSeed();
            if (seed.getAdminPassword() == null || seed.getAdminPassword().isBlank()) {
                LOG.warn("app.seed.enabled is set but app.seed.admin-password is empty; no admin seeded");
                return;
            }
            if (userRepository.findByEmail(seed.getAdminEmail()).isPresent()) {
                return;
            }

            User admin = new User();
            admin.setEmail(seed.getAdminEmail());
            admin.setName("Administrator");
            admin.setPassword(passwordEncoder.encode(seed.getAdminPassword()));
            admin.setRole(Role.ADMIN);
            admin.setIsVerified(true);
            admin.setIsActive(true);
            userRepository.save(admin);
            LOG.info("Seeded admin user with ID: {}", admin.getId());
        };
    }
}
