package com.findstaffing.api.support;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Mints access tokens the way the identity provider does, for tests that
 * need a signed bearer token.
 */
public final class TestAccessTokens {

    public static final String SECRET = "test-secret-key-that-is-at-least-32-characters-long";

    private TestAccessTokens() {}

    public static String issue(UUID profileId) {
        return issue(SECRET, profileId, Duration.ofMinutes(15), "access");
    }

    public static String issue(String secret, UUID profileId, Duration validity, String type) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(profileId.toString())
                .claim("type", type)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(validity)))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
