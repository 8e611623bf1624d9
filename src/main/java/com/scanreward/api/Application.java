package com.scanreward.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scanreward.api.admin.AdminAuthFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.firewall.HttpStatusRequestRejectedHandler;
import org.springframework.security.web.firewall.RequestRejectedHandler;
import org.springframework.stereotype.Component;

// exclude user details service from Spring security. We're not using it.
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
@ConfigurationPropertiesScan(basePackageClasses = Application.class)
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        return builder -> {
            builder.featuresToEnable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            builder.featuresToDisable(
                SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS,
                DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS);
        };
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull BuildProperties buildProperties) {
        return new OpenAPI()
            .info(
                new Info()
                    .title("Scan Reward API")
                    .version(String.format("v%s", buildProperties.getVersion())))
            .components(
                new Components()
                    .addSecuritySchemes("admin-password", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name(AdminAuthFilter.ADMIN_PASSWORD_HEADER)));
    }

    @Bean
    SecurityFilterChain securityFilterChain(
        @NonNull HttpSecurity http,
        @NonNull AdminAuthFilter adminAuthFilter
    ) throws Exception {
        // disable default filters.
        http.cors().disable()
            .csrf().disable()
            .formLogin().disable()
            .headers().disable()
            .httpBasic().disable()
            .jee().disable()
            .logout().disable()
            .rememberMe().disable()
            .requestCache().disable()
            .securityContext().disable()
            .sessionManagement().disable();

        // Always return 401, and never tell a missing admin password apart from a wrong one.
        http.exceptionHandling().authenticationEntryPoint(
            (request, response, authException) -> response.setStatus(HttpServletResponse.SC_UNAUTHORIZED));

        // redemption is public since it is triggered by scanning a printed code.
        http.authorizeHttpRequests()
            .requestMatchers(HttpMethod.POST, "/v1/tokens/*/redeem").permitAll()
            .requestMatchers("/v1/admin/**").fullyAuthenticated()
            .anyRequest().permitAll();

        http.addFilterBefore(adminAuthFilter, AnonymousAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    RequestRejectedHandler requestRejectedHandler() {
        return new HttpStatusRequestRejectedHandler();
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private BuildProperties buildProperties;

        @Override
        public void run(ApplicationArguments args) {
            log.info("Running {} version: v{}", buildProperties.getName(), buildProperties.getVersion());
        }
    }
}
