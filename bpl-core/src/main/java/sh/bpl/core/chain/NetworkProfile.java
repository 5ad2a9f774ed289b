// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Configuration profile for one network.
 *
 * <p>
 * <strong>Field constraints:</strong>
 * <ul>
 * <li>{@code name} - non-empty</li>
 * <li>{@code addressVersion} - fits in one byte</li>
 * <li>{@code epoch} - the instant timestamps are counted from</li>
 * <li>{@code fees} - default fee schedule used by the transaction builders</li>
 * </ul>
 *
 * @param name           human readable name
 * @param addressVersion address version byte
 * @param epoch          network epoch
 * @param fees           default fees
 * @see NetworkProfiles
 */
public record NetworkProfile(String name, int addressVersion, Instant epoch, FeeSchedule fees) {

    public NetworkProfile {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        if (addressVersion < 0 || addressVersion > 0xFF) {
            throw new IllegalArgumentException("addressVersion must fit in one byte, got: " + addressVersion);
        }
        Objects.requireNonNull(epoch, "epoch cannot be null");
        Objects.requireNonNull(fees, "fees cannot be null");
    }

    /**
     * Returns a slot clock for this network backed by the system UTC clock.
     *
     * @return the clock
     */
    public SlotClock clock() {
        return clock(Clock.systemUTC());
    }

    /**
     * Returns a slot clock for this network backed by {@code clock}.
     *
     * @param clock wall clock
     * @return the clock
     */
    public SlotClock clock(final Clock clock) {
        return new EpochSlotClock(epoch, clock);
    }

    /**
     * Returns a copy of this profile with a different fee schedule.
     *
     * @param newFees fee schedule
     * @return new profile
     */
    public NetworkProfile withFees(final FeeSchedule newFees) {
        return new NetworkProfile(name, addressVersion, epoch, newFees);
    }
}
