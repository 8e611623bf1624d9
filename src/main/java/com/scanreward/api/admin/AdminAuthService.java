package com.scanreward.api.admin;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Gates the administrative operations, i.e. token issuance and reporting, behind a shared admin
 * password.
 */
@Service
@Slf4j
public class AdminAuthService {

    static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    private final byte[] passwordDigest;

    @Autowired
    AdminAuthService(@NonNull AdminConfiguration config) {
        this.passwordDigest = sha256(config.getPassword());
    }

    /**
     * Compares the given {@code credential} with the configured admin password. Both values are
     * hashed before a constant-time comparison so that neither their contents nor their lengths
     * leak through response timings.
     *
     * @param credential the presented credential; may be {@literal null}.
     * @return {@literal true} if the credential matches the admin password, {@literal false} if it
     * is absent, blank or different.
     */
    public boolean authorize(String credential) {
        if (credential == null || credential.isBlank()) {
            return false;
        }

        return MessageDigest.isEqual(passwordDigest, sha256(credential));
    }

    /**
     * @param credential the presented credential; may be {@literal null}.
     * @return a non-null {@link Authentication} if the credential is valid, {@literal null}
     * otherwise.
     */
    public Authentication authenticate(String credential) {
        if (!authorize(credential)) {
            log.debug("rejected admin credential");
            return null;
        }

        return new AdminAuthentication();
    }

    @NonNull
    private static byte[] sha256(@NonNull String value) {
        try {
            val digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to support SHA-256.
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static class AdminAuthentication extends AbstractAuthenticationToken {

        private AdminAuthentication() {
            super(AuthorityUtils.createAuthorityList(ADMIN_AUTHORITY));
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            // the credential is never retained after verification.
            return null;
        }

        @Override
        public Object getPrincipal() {
            return "admin";
        }
    }
}
