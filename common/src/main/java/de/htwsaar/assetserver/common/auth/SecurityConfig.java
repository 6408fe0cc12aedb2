package de.htwsaar.assetserver.common.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registriert den {@link AdminAuthFilter} für die Admin-Routen unter {@code /_assetserver/admin/}.
 * Der Token kommt aus {@code assetserver.admin.token}.
 */
@Configuration
public class SecurityConfig {

    @Value("${assetserver.admin.token:secret-token}")
    private String adminToken;

    @Bean
    public AdminAuthFilter adminAuthFilter() {
        return new AdminAuthFilter(adminToken);
    }
}
