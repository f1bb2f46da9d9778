package com.questrail.interlock.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Instantaneous queries answered from the current sensor snapshot without any
 * state change.
 */
public enum ChamberQuery
{
    IS_CHAMBER_OPEN("is_chamber_open"),
    IS_PRODUCT_PRESENT("is_product_present"),
    IS_SAUCE_PRESENT("is_sauce_present");

    /** Answer returned for a query name that is not recognized. */
    public static final int UNRECOGNIZED = -1;

    private final String wireName;

    ChamberQuery(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a query by wire name, accepting the {@code chamber_} prefix.
     */
    public static Optional<ChamberQuery> fromName(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = ChamberCommand.stripDevicePrefix(name.trim().toLowerCase(Locale.ROOT));
        for (ChamberQuery q : values()) {
            if (q.wireName.equals(normalized)) {
                return Optional.of(q);
            }
        }
        return Optional.empty();
    }
}
