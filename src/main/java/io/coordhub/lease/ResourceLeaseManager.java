package io.coordhub.lease;

import io.coordhub.model.ResourceClaim;
import io.coordhub.model.ResourceKind;
import io.coordhub.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Time-bounded claims on named resources, keyed by the exact {@code (kind, resourceId, instanceId)} triple.
 *
 * <p>Claims are mutually exclusive across instances whatever their {@code operation}: a live claim held by
 * another instance is always a conflict. A repeat claim by the current holder replaces its own claim and
 * restarts the TTL. Expired claims never conflict, even before the sweep removes them.
 *
 * <p>Not thread-safe: the owning runtime serializes access.
 */
public final class ResourceLeaseManager {
    private final Map<ClaimKey, ResourceClaim> claims = new LinkedHashMap<>();
    private final Clock clock;

    public ResourceLeaseManager(Clock clock) {
        this.clock = clock;
    }

    public ClaimOutcome claim(ResourceKind kind, String resourceId, String instanceId, String operation, long ttlMs) {
        Instant now = clock.instant();
        List<String> conflicts = conflictingHolders(kind, resourceId, instanceId, now);
        if (!conflicts.isEmpty()) {
            return ClaimOutcome.conflict(conflicts);
        }
        ResourceClaim claim = new ResourceClaim(
                Ids.claimId(),
                kind,
                resourceId,
                instanceId,
                operation,
                now,
                now.plusMillis(ttlMs)
        );
        claims.put(ClaimKey.of(claim), claim);
        return ClaimOutcome.granted(claim);
    }

    public boolean release(ResourceKind kind, String resourceId, String instanceId) {
        return claims.remove(new ClaimKey(kind, resourceId, instanceId)) != null;
    }

    public int releaseAllHeldBy(String instanceId) {
        int removed = 0;
        Iterator<ResourceClaim> it = claims.values().iterator();
        while (it.hasNext()) {
            if (it.next().claimedBy().equals(instanceId)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<ResourceClaim> it = claims.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiredAt(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public List<ResourceClaim> liveClaimsOn(ResourceKind kind, String resourceId) {
        Instant now = clock.instant();
        List<ResourceClaim> out = new ArrayList<>();
        for (ResourceClaim claim : claims.values()) {
            if (claim.sameResource(kind, resourceId) && !claim.expiredAt(now)) {
                out.add(claim);
            }
        }
        return out;
    }

    public List<ResourceClaim> heldBy(String instanceId) {
        List<ResourceClaim> out = new ArrayList<>();
        for (ResourceClaim claim : claims.values()) {
            if (claim.claimedBy().equals(instanceId)) {
                out.add(claim);
            }
        }
        return out;
    }

    /**
     * Current claims keyed by claim id.
     */
    public Map<String, ResourceClaim> snapshot() {
        Map<String, ResourceClaim> out = new LinkedHashMap<>();
        for (ResourceClaim claim : claims.values()) {
            out.put(claim.id(), claim);
        }
        return out;
    }

    public int size() {
        return claims.size();
    }

    private List<String> conflictingHolders(ResourceKind kind, String resourceId, String instanceId, Instant now) {
        Set<String> holders = new LinkedHashSet<>();
        for (ResourceClaim claim : claims.values()) {
            if (!claim.sameResource(kind, resourceId)) {
                continue;
            }
            if (claim.claimedBy().equals(instanceId)) {
                continue;
            }
            if (claim.expiredAt(now)) {
                continue;
            }
            holders.add(claim.claimedBy());
        }
        return new ArrayList<>(holders);
    }

    private record ClaimKey(ResourceKind kind, String resourceId, String instanceId) {
        static ClaimKey of(ResourceClaim claim) {
            return new ClaimKey(claim.resourceKind(), claim.resourceId(), claim.claimedBy());
        }
    }

    public record ClaimOutcome(boolean claimed, List<String> conflictsWith, ResourceClaim claim) {
        static ClaimOutcome granted(ResourceClaim claim) {
            return new ClaimOutcome(true, List.of(), claim);
        }

        static ClaimOutcome conflict(List<String> holders) {
            return new ClaimOutcome(false, List.copyOf(holders), null);
        }
    }
}
