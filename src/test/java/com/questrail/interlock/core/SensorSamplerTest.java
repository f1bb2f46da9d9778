package com.questrail.interlock.core;

import com.questrail.interlock.api.LockState;
import com.questrail.interlock.io.FakeSensorBank;
import com.questrail.interlock.io.SensorTable;
import com.questrail.interlock.io.SignalName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SensorSamplerTest {

    @Test
    void startsFromAllFalseSnapshot() {
        SensorSampler sampler = new SensorSampler(FakeSensorBank.full().table());

        assertSame(SensorSnapshot.initial(), sampler.current());
        assertFalse(sampler.current().chamberOpen());
        assertTrue(sampler.current().lockConfirmed().isEmpty());
    }

    @Test
    void refreshReadsEveryWiredSignalExactlyOnce() {
        FakeSensorBank bank = FakeSensorBank.full();
        SensorSampler sampler = new SensorSampler(bank.table());

        sampler.refresh();

        for (SignalName s : SignalName.values()) {
            assertEquals(1, bank.reads(s), s.name());
        }
    }

    @Test
    void snapshotReflectsSignals() {
        FakeSensorBank bank = FakeSensorBank.full()
                .set(SignalName.CHAMBER_OPEN, true)
                .set(SignalName.PARTITION_DOWN, true)
                .set(SignalName.LOCK_CONFIRMED, true)
                .set(SignalName.PRODUCT_2, true)
                .set(SignalName.SAUCE_3, true);
        SensorSampler sampler = new SensorSampler(bank.table());

        SensorSnapshot s = sampler.refresh();

        assertTrue(s.chamberOpen());
        assertFalse(s.partitionUp());
        assertTrue(s.partitionDown());
        assertEquals(Optional.of(LockState.LOCKED), s.lockConfirmed());
        assertEquals(List.of(false, true), s.productPresence());
        assertEquals(List.of(false, false, true), s.saucePresence());
        assertTrue(s.isProductPresent());
        assertTrue(s.isSaucePresent());
        assertSame(s, sampler.current());
    }

    @Test
    void optionalSignalsAbsentWhenNotWired() {
        FakeSensorBank bank = FakeSensorBank.minimal().set(SignalName.PARTITION_UP, true);
        SensorSampler sampler = new SensorSampler(bank.table());

        SensorSnapshot s = sampler.refresh();

        assertTrue(s.partitionUp());
        assertTrue(s.lockConfirmed().isEmpty());
        assertFalse(s.motorFault());
        assertTrue(s.productPresence().isEmpty());
        assertFalse(s.isProductPresent());
        assertFalse(s.isSaucePresent());
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        FakeSensorBank bank = FakeSensorBank.full().set(SignalName.PARTITION_UP, true);
        SensorSampler sampler = new SensorSampler(bank.table());
        SensorSnapshot before = sampler.refresh();

        bank.set(SignalName.PARTITION_UP, false).set(SignalName.CHAMBER_OPEN, true);
        bank.fail(SignalName.SAUCE_2, true);

        SensorReadException ex = assertThrows(SensorReadException.class, sampler::refresh);
        assertEquals(SignalName.SAUCE_2, ex.signal());
        assertSame(before, sampler.current());
    }

    @Test
    void tableRejectsMissingRequiredSignal() {
        SensorTable.Builder b = SensorTable.builder()
                .with(SignalName.CHAMBER_OPEN, () -> false)
                .with(SignalName.PARTITION_UP, () -> false);

        assertThrows(IllegalStateException.class, b::build);
    }

    @Test
    void gateConfirmationPredicates() {
        SensorSnapshot closedNoFeedback = new SensorSnapshot(false, false, false,
                Optional.empty(), false, List.of(), List.of());
        SensorSnapshot closedUnlocked = new SensorSnapshot(false, false, false,
                Optional.of(LockState.UNLOCKED), false, List.of(), List.of());
        SensorSnapshot open = new SensorSnapshot(true, false, false,
                Optional.of(LockState.LOCKED), false, List.of(), List.of());

        assertTrue(closedNoFeedback.isGateLocked());
        assertFalse(closedNoFeedback.isGateUnlocked());
        assertFalse(closedUnlocked.isGateLocked());
        assertTrue(closedUnlocked.isGateUnlocked());
        assertFalse(open.isGateLocked());
        assertTrue(open.isGateUnlocked());
    }
}
