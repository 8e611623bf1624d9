package com.scanreward.api.admin;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * <p>
 * A {@link OncePerRequestFilter OncePerRequest} security filter to verify the admin password passed
 * using the {@link #ADMIN_PASSWORD_HEADER} request header.</p>
 * <p>
 * If the header is missing or wrong, the filter leaves the existing {@link
 * org.springframework.security.core.context.SecurityContext SecurityContext} untouched, and Spring
 * Security rejects requests to admin endpoints with a 401 response. If the header is valid, the
 * filter sets a new {@link org.springframework.security.core.context.SecurityContext
 * SecurityContext} with an admin {@link org.springframework.security.core.Authentication
 * Authentication} on the {@link SecurityContextHolder}.</p>
 */
@Component
public class AdminAuthFilter extends OncePerRequestFilter {

    public static final String ADMIN_PASSWORD_HEADER = "X-Admin-Password";

    private final AdminAuthService adminAuthService;

    @Autowired
    public AdminAuthFilter(@NonNull AdminAuthService adminAuthService) {
        this.adminAuthService = adminAuthService;
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        verifyAdminPasswordHeader(request);
        filterChain.doFilter(request, response);
    }

    private void verifyAdminPasswordHeader(@NonNull HttpServletRequest request) {
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            return; // a previous filter may have performed authentication.
        }

        val header = request.getHeader(ADMIN_PASSWORD_HEADER);
        if (header == null) {
            return;
        }

        val authentication = adminAuthService.authenticate(header);
        if (authentication == null) {
            return;
        }

        val context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
    }
}
