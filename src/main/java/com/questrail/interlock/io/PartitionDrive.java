package com.questrail.interlock.io;

/**
 * PartitionDrive
 * -----------------------------------------------------------------------------
 * Write capabilities of the partition motor driver.
 *
 * <p>Commands are fire-and-forget: the driver starts the motion and returns.
 * Arrival is observed through the partition limit switches, never through the
 * return value of these calls.</p>
 */
public interface PartitionDrive
{
    /**
     * Starts moving the partition.
     *
     * @param direction travel direction
     * @param speed     driver-specific speed magnitude, always positive
     */
    void move(PartitionDirection direction, int speed);

    /** Stops the partition where it is. */
    void stop();

    /** Clears a latched motor-driver fault. */
    void resetFault();
}
