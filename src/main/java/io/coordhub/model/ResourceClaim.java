package io.coordhub.model;

import java.time.Instant;

public record ResourceClaim(
        String id,
        ResourceKind resourceKind,
        String resourceId,
        String claimedBy,
        String operation,
        Instant claimedAt,
        Instant expiresAt
) {
    /**
     * Display label {@code kind:resourceId} for audit rows. Not unique when ids contain {@code :}; never a map key.
     */
    public static String resourceKey(ResourceKind kind, String resourceId) {
        return kind.wireName() + ":" + resourceId;
    }

    public boolean sameResource(ResourceKind kind, String otherResourceId) {
        return resourceKind == kind && resourceId.equals(otherResourceId);
    }

    public boolean expiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
