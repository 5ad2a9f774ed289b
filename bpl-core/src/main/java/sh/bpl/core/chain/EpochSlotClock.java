// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link SlotClock} counting whole seconds from a fixed epoch.
 */
final class EpochSlotClock implements SlotClock {

    private final Instant epoch;
    private final Clock clock;

    EpochSlotClock(final Instant epoch, final Clock clock) {
        this.epoch = Objects.requireNonNull(epoch, "epoch cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public long now() {
        final long seconds = Duration.between(epoch, clock.instant()).getSeconds();
        if (seconds < 0) {
            throw new IllegalStateException("Clock " + clock.instant() + " is before the network epoch " + epoch);
        }
        return seconds;
    }
}
