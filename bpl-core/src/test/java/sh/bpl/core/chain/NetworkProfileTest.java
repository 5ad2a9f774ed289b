// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class NetworkProfileTest {

    @Test
    void publicNetworksShareEpochAndFees() {
        assertEquals(Instant.parse("2017-03-21T13:00:00Z"), NetworkProfiles.MAINNET.epoch());
        assertEquals(NetworkProfiles.MAINNET.epoch(), NetworkProfiles.TESTNET.epoch());
        assertSame(NetworkProfiles.DEFAULT_FEES, NetworkProfiles.MAINNET.fees());
        assertEquals(0x19, NetworkProfiles.MAINNET.addressVersion());
        assertEquals(0x52, NetworkProfiles.TESTNET.addressVersion());
    }

    @Test
    void clockCountsWholeSecondsSinceEpoch() {
        Instant at = NetworkProfiles.EPOCH.plusSeconds(10_000_000L).plusMillis(999);
        SlotClock clock = NetworkProfiles.MAINNET.clock(Clock.fixed(at, ZoneOffset.UTC));
        assertEquals(10_000_000L, clock.now());
    }

    @Test
    void clockAtEpochIsZero() {
        SlotClock clock = NetworkProfiles.MAINNET.clock(Clock.fixed(NetworkProfiles.EPOCH, ZoneOffset.UTC));
        assertEquals(0L, clock.now());
    }

    @Test
    void clockBeforeEpochFails() {
        SlotClock clock = NetworkProfiles.MAINNET.clock(
                Clock.fixed(NetworkProfiles.EPOCH.minusSeconds(1), ZoneOffset.UTC));
        assertThrows(IllegalStateException.class, clock::now);
    }

    @Test
    void systemClockIsPastEpoch() {
        assertTrue(NetworkProfiles.MAINNET.clock().now() > 0);
    }

    @Test
    void withFeesKeepsIdentity() {
        FeeSchedule cheap = new FeeSchedule(1, 2, 3, 4, 5);
        NetworkProfile custom = NetworkProfiles.TESTNET.withFees(cheap);
        assertEquals("testnet", custom.name());
        assertEquals(0x52, custom.addressVersion());
        assertSame(cheap, custom.fees());
    }

    @Test
    void rejectsInvalidProfiles() {
        assertThrows(IllegalArgumentException.class,
                () -> new NetworkProfile(" ", 0x19, NetworkProfiles.EPOCH, NetworkProfiles.DEFAULT_FEES));
        assertThrows(IllegalArgumentException.class,
                () -> new NetworkProfile("devnet", 256, NetworkProfiles.EPOCH, NetworkProfiles.DEFAULT_FEES));
        assertThrows(NullPointerException.class,
                () -> new NetworkProfile("devnet", 1, null, NetworkProfiles.DEFAULT_FEES));
    }
}
