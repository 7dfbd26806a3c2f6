package com.classgate.authservice.config;

import com.classgate.authservice.domain.AuthService;
import com.classgate.authservice.domain.PasswordPolicy;
import com.classgate.authservice.domain.UserRepository;
import com.classgate.observability.SensitiveDataRedactor;
import com.classgate.security.AccessControl;
import com.classgate.security.PasswordHasher;
import com.classgate.security.TokenService;
import com.classgate.security.TokenSettings;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the security components once from {@link AuthProperties} and hands them to their users
 * by constructor. Nothing downstream reads configuration on its own.
 */
@Configuration
public class AuthServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenSettings tokenSettings(AuthProperties properties) {
        var settings = new TokenSettings(properties.jwtSecret(), properties.tokenTtl(), properties.issuer());
        log.info("Token settings loaded: {}", settings);
        return settings;
    }

    @Bean
    public TokenService tokenService(TokenSettings settings, Clock clock) {
        return new TokenService(settings, clock);
    }

    @Bean
    public PasswordHasher passwordHasher(AuthProperties properties) {
        return new PasswordHasher(properties.workFactor());
    }

    @Bean
    public PasswordPolicy passwordPolicy(AuthProperties properties) {
        AuthProperties.Password password = properties.password();
        return new PasswordPolicy(password.minLength(), password.requireLetter(), password.requireDigit());
    }

    @Bean
    public AccessControl accessControl(TokenService tokenService) {
        return new AccessControl(tokenService);
    }

    @Bean
    public AuthService authService(
            UserRepository users,
            PasswordHasher passwordHasher,
            TokenService tokenService,
            AccessControl accessControl,
            PasswordPolicy passwordPolicy,
            Clock clock) {
        return new AuthService(users, passwordHasher, tokenService, accessControl, passwordPolicy, clock);
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
