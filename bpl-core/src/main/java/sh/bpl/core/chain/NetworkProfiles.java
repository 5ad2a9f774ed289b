// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

import java.time.Instant;

/**
 * Pre-configured network profiles.
 *
 * <pre>{@code
 * NetworkProfile custom = NetworkProfiles.MAINNET.withFees(
 *     new FeeSchedule(5_000_000L, 500_000_000L, 2_500_000_000L, 100_000_000L, 500_000_000L));
 * }</pre>
 *
 * @see NetworkProfile
 */
public final class NetworkProfiles {
    private NetworkProfiles() {}

    /** Epoch shared by the public networks: 2017-03-21T13:00:00Z. */
    public static final Instant EPOCH = Instant.parse("2017-03-21T13:00:00Z");

    /** Default fees, in the smallest unit (1 coin = 10^8). */
    public static final FeeSchedule DEFAULT_FEES =
            new FeeSchedule(10_000_000L, 500_000_000L, 2_500_000_000L, 100_000_000L, 500_000_000L);

    /** Main network, address version {@code 0x19}. */
    public static final NetworkProfile MAINNET = new NetworkProfile("mainnet", 0x19, EPOCH, DEFAULT_FEES);

    /** Test network, address version {@code 0x52}. */
    public static final NetworkProfile TESTNET = new NetworkProfile("testnet", 0x52, EPOCH, DEFAULT_FEES);
}
