package com.questrail.interlock.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChamberCommandTest {

    @ParameterizedTest
    @EnumSource(ChamberCommand.class)
    void everyCommandResolvesByWireNameWithAndWithoutPrefix(ChamberCommand command) {
        assertEquals(Optional.of(command), ChamberCommand.fromName(command.wireName()));
        assertEquals(Optional.of(command), ChamberCommand.fromName("chamber_" + command.wireName()));
    }

    @Test
    void matchingIgnoresCaseAndSurroundingBlanks() {
        assertEquals(Optional.of(ChamberCommand.PARTITION_UP), ChamberCommand.fromName("  Partition_Up "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "chamber_", "open", "partition_sideways", "chamber_chamber_initialize"})
    void unknownNamesAreEmpty(String name) {
        assertTrue(ChamberCommand.fromName(name).isEmpty());
    }

    @Test
    void queriesResolveLikeCommands() {
        assertEquals(Optional.of(ChamberQuery.IS_SAUCE_PRESENT), ChamberQuery.fromName("chamber_is_sauce_present"));
        assertEquals(Optional.of(ChamberQuery.IS_CHAMBER_OPEN), ChamberQuery.fromName("IS_CHAMBER_OPEN"));
        assertTrue(ChamberQuery.fromName("is_lid_open").isEmpty());
    }

    @Test
    void resultRequiresItsFields() {
        assertThrows(NullPointerException.class,
                () -> new CommandResult(null, CommandResult.Outcome.SUCCESS, Optional.empty()));
        assertTrue(CommandResult.success(ChamberCommand.INITIALIZE).isSuccess());
        assertEquals(Optional.empty(), CommandResult.error("x", null).message());
    }
}
