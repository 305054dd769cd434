package com.seatplanner.backend.modules.party.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GuestTokenGeneratorTest {

    @Test
    @DisplayName("tokens are URL-safe and carry the configured entropy")
    void tokensAreUrlSafe() {
        GuestTokenGenerator generator = new GuestTokenGenerator(new SecureRandom(), 16);

        String token = generator.nextToken();

        assertThat(token).matches("[A-Za-z0-9_-]+");
        assertThat(Base64.getUrlDecoder().decode(token)).hasSize(16);
    }

    @Test
    void tokensDoNotRepeat() {
        GuestTokenGenerator generator = new GuestTokenGenerator(new SecureRandom(), 16);
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(generator.nextToken());
        }
        assertThat(tokens).hasSize(1000);
    }

    @Test
    void rejectsWeakTokens() {
        assertThatThrownBy(() -> new GuestTokenGenerator(new SecureRandom(), 8))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
