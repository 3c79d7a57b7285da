package com.findstaffing.api.auth;

import com.findstaffing.api.config.StaffingProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Validates HMAC-SHA256 signed access tokens minted by the identity provider
 * that shares the secret. The subject is the caller's profile id.
 */
@Service
public class JwtTokenService {

    private static final String TOKEN_TYPE = "access";

    private final SecretKey signingKey;

    @Autowired
    public JwtTokenService(StaffingProperties properties) {
        this(properties.getJwt().getSecret());
    }

    public JwtTokenService(String jwtSecret) {
        if (jwtSecret == null || jwtSecret.length() < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 32 characters");
        }
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Validates and parses an access token.
     * Returns claims if valid, throws exception if invalid.
     */
    public TokenClaims validateAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (!TOKEN_TYPE.equals(claims.get("type", String.class))) {
                throw new JwtException("Invalid token type");
            }

            return new TokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.getExpiration().toInstant());
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Access token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record TokenClaims(UUID profileId, Instant expiry) {}

    public static class TokenExpiredException extends RuntimeException {
        public TokenExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
