package com.questrail.interlock.io;

/**
 * Read capability for a single digital input.
 * <p>
 * Implementations wrap whatever the fieldbus driver exposes. A read should
 * return promptly; it is called on the control-cycle thread.
 */
@FunctionalInterface
public interface SignalReader
{
    /**
     * Returns the current value of the input.
     *
     * @throws RuntimeException if the underlying I/O fails
     */
    boolean read();
}
