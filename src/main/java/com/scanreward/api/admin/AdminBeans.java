package com.scanreward.api.admin;

import lombok.NonNull;
import lombok.val;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the admin auth components.
 */
@Configuration
class AdminBeans {

    /**
     * Prevents Spring Web from automatically adding the auth filter bean to its filter chain
     * because it has to be added to Spring Security's filter chain and not Spring Web's.
     */
    @NonNull
    @Bean
    public FilterRegistrationBean<AdminAuthFilter> adminAuthFilterRegistration(AdminAuthFilter filter) {
        val registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
