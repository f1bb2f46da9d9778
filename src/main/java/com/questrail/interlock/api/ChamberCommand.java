package com.questrail.interlock.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * ChamberCommand
 * -----------------------------------------------------------------------------
 * Named commands an external actor may submit to a chamber.
 *
 * <p>Each accepted command resolves exactly once to a {@link CommandResult}.
 * Commands are identified on the wire by their {@link #wireName()}; callers may
 * also use the device-prefixed form ({@code chamber_block_for_client}) that the
 * event dispatcher of the production line uses.</p>
 */
public enum ChamberCommand
{
    INITIALIZE("initialize"),
    BLOCK_FOR_CLIENT("block_for_client"),
    UNBLOCK_FOR_CLIENT("unblock_for_client"),
    BLOCK_CHAMBER("block_chamber"),
    UNBLOCK_CHAMBER("unblock_chamber"),
    PARTITION_UP("partition_up"),
    PARTITION_DOWN("partition_down"),
    MAINTENANCE_ENABLE("maintenance_enable"),
    MAINTENANCE_DISABLE("maintenance_disable");

    /** Prefix the event dispatcher puts in front of chamber event types. */
    public static final String DEVICE_PREFIX = "chamber_";

    private final String wireName;

    ChamberCommand(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a command by wire name, with or without the {@code chamber_}
     * prefix. Matching is case-insensitive.
     *
     * @param name command name (must not be {@code null})
     * @return the command, or empty if the name is not recognized
     */
    public static Optional<ChamberCommand> fromName(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = stripDevicePrefix(name.trim().toLowerCase(Locale.ROOT));
        for (ChamberCommand c : values()) {
            if (c.wireName.equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    static String stripDevicePrefix(String name) {
        return name.startsWith(DEVICE_PREFIX) ? name.substring(DEVICE_PREFIX.length()) : name;
    }
}
