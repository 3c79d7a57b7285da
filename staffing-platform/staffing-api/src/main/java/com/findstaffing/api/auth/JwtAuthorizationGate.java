package com.findstaffing.api.auth;

import com.findstaffing.api.agency.ProfileDirectory;
import com.findstaffing.api.error.ForbiddenException;
import com.findstaffing.api.error.UnauthorizedException;
import com.findstaffing.core.domain.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bearer-token gate: the token names the caller, the profile row holds the role.
 */
@Component
public class JwtAuthorizationGate implements AuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthorizationGate.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService tokenService;
    private final ProfileDirectory profiles;

    public JwtAuthorizationGate(JwtTokenService tokenService, ProfileDirectory profiles) {
        this.tokenService = tokenService;
        this.profiles = profiles;
    }

    @Override
    public CallerIdentity requireAdmin(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Authentication required");
        }

        JwtTokenService.TokenClaims claims;
        try {
            claims = tokenService.validateAccessToken(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
        } catch (JwtTokenService.TokenExpiredException | JwtTokenService.InvalidTokenException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthorizedException("Authentication required");
        }

        Profile profile = profiles.find(claims.profileId())
                .orElseThrow(() -> new ForbiddenException("Admin access required"));
        if (!profile.isAdmin()) {
            log.info("Non-admin profile {} attempted an admin operation", profile.getId());
            throw new ForbiddenException("Admin access required");
        }
        return new CallerIdentity(profile.getId(), profile.getRole());
    }
}
