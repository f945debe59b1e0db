package com.example.widgetstate.shared.auth;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Issues and verifies HMAC-SHA256 signed tokens of the form
 * {@code subject:issuedAt:expiry:signature}, with times in epoch seconds and an expiry of
 * {@code 0} for tokens that never expire. Session tokens carry a user id; widget tokens carry a
 * widget id and are short lived.
 */
@Slf4j
public class SessionTokenService {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int GENERATED_SECRET_BYTES = 32;

    private final byte[] secret;
    private final Duration widgetTokenTtl;
    private final Clock clock;

    public SessionTokenService(String secret, Duration widgetTokenTtl, Clock clock) {
        if (secret == null || secret.isBlank()) {
            byte[] random = new byte[GENERATED_SECRET_BYTES];
            new SecureRandom().nextBytes(random);
            this.secret = HexFormat.of().formatHex(random).getBytes(StandardCharsets.UTF_8);
            log.warn("No token secret configured; generated a random one. Tokens will not validate on other workers.");
        } else {
            this.secret = secret.getBytes(StandardCharsets.UTF_8);
        }
        this.widgetTokenTtl = widgetTokenTtl;
        this.clock = clock;
    }

    /**
     * @param expiresAt when the token stops validating; {@code null} for a token that never expires
     */
    public String generateSessionToken(String userId, Instant expiresAt) {
        if (userId == null || userId.isEmpty() || userId.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Token subject must be non-empty and must not contain ':'");
        }
        long issuedAt = clock.instant().getEpochSecond();
        long expiry = expiresAt != null ? expiresAt.getEpochSecond() : 0L;
        String payload = userId + ":" + issuedAt + ":" + expiry;
        return payload + ":" + sign(payload);
    }

    public TokenValidation validateSessionToken(String token) {
        if (token == null) {
            return TokenValidation.invalid("Invalid token format");
        }
        String[] parts = token.split(":", -1);
        if (parts.length != 4) {
            return TokenValidation.invalid("Invalid token format");
        }
        String subject = parts[0];
        long expiry;
        try {
            Long.parseLong(parts[1]);
            expiry = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            return TokenValidation.invalid("Token parse error: " + e.getMessage());
        }
        if (expiry > 0 && expiry < clock.instant().getEpochSecond()) {
            return TokenValidation.invalid("Token expired");
        }
        String expected = sign(parts[0] + ":" + parts[1] + ":" + parts[2]);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), parts[3].getBytes(StandardCharsets.UTF_8))) {
            return TokenValidation.invalid("Invalid signature");
        }
        return TokenValidation.valid(subject);
    }

    public String generateWidgetToken(String widgetId) {
        return generateWidgetToken(widgetId, widgetTokenTtl);
    }

    public String generateWidgetToken(String widgetId, Duration ttl) {
        Duration lifetime = ttl != null ? ttl : widgetTokenTtl;
        return generateSessionToken(widgetId, clock.instant().plus(lifetime));
    }

    public boolean validateWidgetToken(String token, String widgetId) {
        TokenValidation validation = validateSessionToken(token);
        return validation.isValid() && validation.getSubject().map(widgetId::equals).orElse(false);
    }

    private String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
