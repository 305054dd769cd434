package com.seatplanner.backend.modules.party.application;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import com.seatplanner.backend.global.config.SeatingProperties;

/**
 * Issues the opaque guest tokens carried in invitation QR codes: URL-safe Base64 over
 * {@code app.seating.token-bytes} bytes from a {@link SecureRandom}.
 */
@Component
public class GuestTokenGenerator {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;
    private final int tokenBytes;

    public GuestTokenGenerator(SeatingProperties seatingProperties) {
        this(new SecureRandom(), seatingProperties.tokenBytes());
    }

    GuestTokenGenerator(SecureRandom random, int tokenBytes) {
        if (tokenBytes < 16) {
            throw new IllegalArgumentException("tokenBytes must be >= 16");
        }
        this.random = random;
        this.tokenBytes = tokenBytes;
    }

    public String nextToken() {
        byte[] bytes = new byte[tokenBytes];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
