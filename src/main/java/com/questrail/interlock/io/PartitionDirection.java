package com.questrail.interlock.io;

/**
 * Direction of partition travel. {@link #UP} opens the passage to the
 * production side, {@link #DOWN} closes it.
 */
public enum PartitionDirection
{
    UP,
    DOWN
}
