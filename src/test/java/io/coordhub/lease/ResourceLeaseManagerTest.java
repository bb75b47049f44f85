package io.coordhub.lease;

import io.coordhub.MutableClock;
import io.coordhub.model.ResourceClaim;
import io.coordhub.model.ResourceKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class ResourceLeaseManagerTest {
    private static final long TTL_MS = Duration.ofMinutes(30).toMillis();

    @Test
    void secondInstanceConflictsUntilHolderReleases() {
        ResourceLeaseManager leases = new ResourceLeaseManager(MutableClock.atEpochSecond(1_000L));

        ResourceLeaseManager.ClaimOutcome a = leases.claim(ResourceKind.BRANCH, "feature/x", "A", "write", TTL_MS);
        Assertions.assertTrue(a.claimed());

        ResourceLeaseManager.ClaimOutcome b = leases.claim(ResourceKind.BRANCH, "feature/x", "B", "read", TTL_MS);
        Assertions.assertFalse(b.claimed());
        Assertions.assertEquals(List.of("A"), b.conflictsWith());
        Assertions.assertEquals(1, leases.size());

        Assertions.assertTrue(leases.release(ResourceKind.BRANCH, "feature/x", "A"));
        Assertions.assertTrue(leases.claim(ResourceKind.BRANCH, "feature/x", "B", "read", TTL_MS).claimed());
    }

    @Test
    void colonsInIdsNeverMergeDistinctClaims() {
        ResourceLeaseManager leases = new ResourceLeaseManager(MutableClock.atEpochSecond(1_000L));
        Assertions.assertTrue(leases.claim(ResourceKind.FILE, "a", "b:c", "write", TTL_MS).claimed());
        Assertions.assertTrue(leases.claim(ResourceKind.FILE, "a:b", "c", "write", TTL_MS).claimed());

        Assertions.assertEquals(2, leases.size());
        Assertions.assertEquals(1, leases.liveClaimsOn(ResourceKind.FILE, "a").size());

        ResourceLeaseManager.ClaimOutcome third = leases.claim(ResourceKind.FILE, "a", "d", "write", TTL_MS);
        Assertions.assertFalse(third.claimed());
        Assertions.assertEquals(List.of("b:c"), third.conflictsWith());

        Assertions.assertTrue(leases.release(ResourceKind.FILE, "a:b", "c"));
        Assertions.assertEquals("b:c", leases.liveClaimsOn(ResourceKind.FILE, "a").get(0).claimedBy());
        Assertions.assertFalse(leases.release(ResourceKind.FILE, "a:b", "c"));
    }

    @Test
    void sameNameDifferentKindDoesNotConflict() {
        ResourceLeaseManager leases = new ResourceLeaseManager(MutableClock.atEpochSecond(1_000L));
        leases.claim(ResourceKind.ISSUE, "42", "A", "write", TTL_MS);
        Assertions.assertTrue(leases.claim(ResourceKind.PR, "42", "B", "write", TTL_MS).claimed());
    }

    @Test
    void holderReclaimReplacesItsOwnClaim() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        ResourceLeaseManager leases = new ResourceLeaseManager(clock);
        leases.claim(ResourceKind.FILE, "src/App.java", "A", "read", TTL_MS);
        clock.advance(Duration.ofMinutes(10));

        ResourceLeaseManager.ClaimOutcome again = leases.claim(ResourceKind.FILE, "src/App.java", "A", "write", TTL_MS);

        Assertions.assertTrue(again.claimed());
        Assertions.assertEquals(1, leases.size());
        ResourceClaim held = leases.heldBy("A").get(0);
        Assertions.assertEquals("write", held.operation());
        Assertions.assertEquals(clock.instant().plusMillis(TTL_MS), held.expiresAt());
    }

    @Test
    void expiredClaimNeverConflictsAndSweepRemovesIt() {
        MutableClock clock = MutableClock.atEpochSecond(1_000L);
        ResourceLeaseManager leases = new ResourceLeaseManager(clock);
        leases.claim(ResourceKind.BRANCH, "main", "A", "write", TTL_MS);
        leases.claim(ResourceKind.BRANCH, "dev", "A", "write", TTL_MS * 2);
        clock.advance(Duration.ofMinutes(31));

        Assertions.assertTrue(leases.liveClaimsOn(ResourceKind.BRANCH, "main").isEmpty());
        Assertions.assertTrue(leases.claim(ResourceKind.BRANCH, "main", "B", "write", TTL_MS).claimed());
        Assertions.assertEquals(1, leases.sweepExpired());
        Assertions.assertEquals(2, leases.size());
        Assertions.assertEquals(0, leases.sweepExpired());
    }

    @Test
    void releaseAllHeldByRemovesOnlyThatInstancesClaims() {
        ResourceLeaseManager leases = new ResourceLeaseManager(MutableClock.atEpochSecond(1_000L));
        leases.claim(ResourceKind.BRANCH, "feature/a", "A", "write", TTL_MS);
        leases.claim(ResourceKind.FILE, "README.md", "A", "write", TTL_MS);
        leases.claim(ResourceKind.BRANCH, "feature/b", "B", "write", TTL_MS);

        Assertions.assertEquals(2, leases.releaseAllHeldBy("A"));
        Assertions.assertTrue(leases.heldBy("A").isEmpty());
        Assertions.assertEquals(1, leases.heldBy("B").size());
    }

    @Test
    void releaseOfUnknownClaimReportsFalse() {
        ResourceLeaseManager leases = new ResourceLeaseManager(MutableClock.atEpochSecond(1_000L));
        leases.claim(ResourceKind.BRANCH, "feature/x", "A", "write", TTL_MS);
        Assertions.assertFalse(leases.release(ResourceKind.BRANCH, "feature/x", "B"));
        Assertions.assertEquals(1, leases.size());
    }
}
