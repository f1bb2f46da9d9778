package com.questrail.interlock.core.watchdog;

import java.util.Objects;

/**
 * Identifies one registered watchdog so it can be cancelled later.
 */
public record WatchdogHandle(long id, String name) {
    public WatchdogHandle {
        Objects.requireNonNull(name, "name");
    }
}
