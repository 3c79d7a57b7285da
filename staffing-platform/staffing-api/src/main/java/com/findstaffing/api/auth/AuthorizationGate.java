package com.findstaffing.api.auth;

/**
 * Decides whether a request may run an admin operation.
 */
public interface AuthorizationGate {

    /**
     * Resolves the caller from the {@code Authorization} header value and
     * requires the admin role.
     *
     * @throws com.findstaffing.api.error.UnauthorizedException when no caller can be identified
     * @throws com.findstaffing.api.error.ForbiddenException when the caller is not an admin
     */
    CallerIdentity requireAdmin(String authorizationHeader);
}
