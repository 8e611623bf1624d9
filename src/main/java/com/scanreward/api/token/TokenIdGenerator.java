package com.scanreward.api.token;

import com.scanreward.api.token.exceptions.EntropySourceUnavailableException;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates unguessable token ids. Each id encodes {@value #ID_BYTES} bytes from a {@link
 * SecureRandom} as lowercase hex, i.e. 128 bits of entropy in 32 characters.
 */
@Component
public class TokenIdGenerator {

    static final int ID_BYTES = 16;

    private final SecureRandom random;

    @Autowired
    TokenIdGenerator(@NonNull TokenConfiguration config) {
        this(createSecureRandom(config.getSecureRandomAlgorithm()));
    }

    TokenIdGenerator(@NonNull SecureRandom random) {
        this.random = random;
    }

    /**
     * @return a new token id.
     * @throws EntropySourceUnavailableException if the secure random source fails to produce bytes.
     */
    @NonNull
    public String generate() {
        val bytes = new byte[ID_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (ProviderException e) {
            throw new EntropySourceUnavailableException("failed to read from the secure random source", e);
        }

        return HexFormat.of().formatHex(bytes);
    }

    @NonNull
    static SecureRandom createSecureRandom(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            return new SecureRandom();
        }

        try {
            return SecureRandom.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new EntropySourceUnavailableException("secure random algorithm is not available: " + algorithm, e);
        }
    }
}
