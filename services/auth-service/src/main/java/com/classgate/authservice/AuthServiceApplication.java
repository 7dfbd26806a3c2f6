package com.classgate.authservice;

import com.classgate.authservice.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Classgate Auth Service: registration, login and role-gated access.
 *
 * <p>Layout:
 *
 * <ul>
 *   <li>{@code domain}: users, the repository port and {@code AuthService}
 *   <li>{@code infrastructure.persistence}: repository adapters
 *   <li>{@code infrastructure.web}: correlation filter, token resolution, error mapping
 *   <li>{@code api}: REST controllers under {@code /api/v1}
 *   <li>{@code config}: properties and bean wiring
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthProperties.class)
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Classgate Auth Service started successfully");
    }
}
