package com.questrail.interlock.io;

/**
 * Write capability for the client-facing indicator. Implementations switch the
 * requested colour on and every other colour off.
 */
@FunctionalInterface
public interface IndicatorLamp
{
    void show(IndicatorColor color);
}
