package com.scanreward.api.admin;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties used by the admin auth components.
 */
@Validated
@ConfigurationProperties("app.admin")
@Data
class AdminConfiguration {

    /**
     * Shared secret that admin clients present in the {@link AdminAuthFilter#ADMIN_PASSWORD_HEADER}
     * header.
     */
    @NotBlank
    private final String password;
}
