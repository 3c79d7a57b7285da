package com.findstaffing.api.auth;

import java.util.UUID;

/**
 * Authenticated admin on whose behalf an operation runs; recorded as editor/verifier.
 */
public record CallerIdentity(UUID userId, String role) {}
