// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

/**
 * Source of transaction timestamps in network epoch units.
 */
@FunctionalInterface
public interface SlotClock {

    /**
     * Returns the current timestamp.
     *
     * @return whole seconds elapsed since the network epoch
     */
    long now();
}
