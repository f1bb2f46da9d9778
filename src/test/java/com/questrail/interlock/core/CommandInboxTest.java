package com.questrail.interlock.core;

import com.questrail.interlock.api.ChamberCommand;
import com.questrail.interlock.api.CommandResult;
import com.questrail.interlock.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CommandInboxTest {

    private ManualMonotonicClock clock;
    private CommandInbox inbox;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        inbox = new CommandInbox(clock);
    }

    @Test
    void secondSubmitWhilePendingIsANoOp() {
        CompletableFuture<CommandResult> first = inbox.submit(ChamberCommand.PARTITION_DOWN);
        clock.advanceMillis(50);
        CompletableFuture<CommandResult> second = inbox.submit(ChamberCommand.PARTITION_DOWN);

        assertSame(first, second);
        assertEquals(Set.of(ChamberCommand.PARTITION_DOWN), inbox.snapshot().pending());
        assertEquals(Optional.of(0L), inbox.submittedAtNanos(ChamberCommand.PARTITION_DOWN));
    }

    @Test
    void submitWhileInProgressReturnsSameFuture() {
        CompletableFuture<CommandResult> first = inbox.submit(ChamberCommand.PARTITION_DOWN);
        assertTrue(inbox.take(ChamberCommand.PARTITION_DOWN));

        assertSame(first, inbox.submit(ChamberCommand.PARTITION_DOWN));
        assertFalse(inbox.peek(ChamberCommand.PARTITION_DOWN), "resubmission must not re-arm the pending flag");
    }

    @Test
    void takeConsumesPendingFlagButKeepsCommandRecorded() {
        inbox.submit(ChamberCommand.PARTITION_UP);

        assertTrue(inbox.peek(ChamberCommand.PARTITION_UP));
        assertTrue(inbox.take(ChamberCommand.PARTITION_UP));
        assertFalse(inbox.peek(ChamberCommand.PARTITION_UP));
        assertFalse(inbox.take(ChamberCommand.PARTITION_UP));
        assertTrue(inbox.isRecorded(ChamberCommand.PARTITION_UP));

        PendingCommands view = inbox.snapshot();
        assertFalse(view.isPending(ChamberCommand.PARTITION_UP));
        assertTrue(view.isRecorded(ChamberCommand.PARTITION_UP));
    }

    @Test
    void completeResolvesFutureOnceAndForgetsCommand() {
        CompletableFuture<CommandResult> f = inbox.submit(ChamberCommand.BLOCK_CHAMBER);

        assertTrue(inbox.complete(ChamberCommand.BLOCK_CHAMBER, CommandResult.Outcome.SUCCESS, null));
        assertFalse(inbox.complete(ChamberCommand.BLOCK_CHAMBER, CommandResult.Outcome.ERROR, "late"));

        CommandResult result = f.join();
        assertEquals("block_chamber", result.command());
        assertTrue(result.isSuccess());
        assertTrue(result.message().isEmpty());
        assertFalse(inbox.isRecorded(ChamberCommand.BLOCK_CHAMBER));
    }

    @Test
    void resubmitAfterCompletionCreatesNewCommand() {
        CompletableFuture<CommandResult> first = inbox.submit(ChamberCommand.UNBLOCK_CHAMBER);
        inbox.complete(ChamberCommand.UNBLOCK_CHAMBER, CommandResult.Outcome.SUCCESS, null);

        CompletableFuture<CommandResult> second = inbox.submit(ChamberCommand.UNBLOCK_CHAMBER);

        assertNotSame(first, second);
        assertFalse(second.isDone());
    }

    @Test
    void completeWithoutSubmitReturnsFalse() {
        assertFalse(inbox.complete(ChamberCommand.INITIALIZE, CommandResult.Outcome.SUCCESS, null));
    }

    @Test
    void unknownNameCompletesImmediatelyWithError() {
        CommandResult r = inbox.submit("open_sesame").join();

        assertEquals(CommandResult.Outcome.ERROR, r.outcome());
        assertEquals("open_sesame", r.command());
        assertTrue(inbox.snapshot().pending().isEmpty());
    }

    @Test
    void namesAcceptDevicePrefixAndAnyCase() {
        CompletableFuture<CommandResult> a = inbox.submit("chamber_partition_down");
        CompletableFuture<CommandResult> b = inbox.submit("PARTITION_DOWN");

        assertSame(a, b);
        assertTrue(inbox.peek(ChamberCommand.PARTITION_DOWN));
    }

    @Test
    void concurrentSubmitsRecordOneCommand() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(64);
        Set<CompletableFuture<CommandResult>> futures = java.util.concurrent.ConcurrentHashMap.newKeySet();

        try {
            for (int i = 0; i < 64; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        futures.add(inbox.submit(ChamberCommand.MAINTENANCE_ENABLE));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, futures.size());
        assertEquals(Set.of(ChamberCommand.MAINTENANCE_ENABLE), inbox.snapshot().pending());
    }
}
