package me.golemcore.datapilot.domain.loop;

import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.model.LoopState;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LoopStateTrackerTest {

    private final LoopStateTracker tracker = new LoopStateTracker();

    @Test
    void shouldWalkThroughStatesAndReturnToAwaitingUser() {
        assertEquals(LoopState.AWAITING_USER, tracker.current("p1"));

        tracker.enter("p1");
        assertEquals(LoopState.MODEL_THINKING, tracker.current("p1"));
        tracker.transition("p1", LoopState.TOOL_DISPATCH);
        assertEquals(LoopState.TOOL_DISPATCH, tracker.current("p1"));
        tracker.release("p1");

        assertEquals(LoopState.AWAITING_USER, tracker.current("p1"));
        assertFalse(tracker.isActive("p1"));
    }

    @Test
    void shouldRejectSecondEnter() {
        tracker.enter("p1");

        assertThrows(ConcurrentModificationException.class, () -> tracker.enter("p1"));
        tracker.enter("p2");
        assertTrue(tracker.isActive("p2"));
    }

    @Test
    void shouldFailTransitionWithoutActiveTurn() {
        assertThrows(IllegalStateException.class, () -> tracker.transition("p1", LoopState.RESPONDING));
    }

    @Test
    void shouldTrackRunningInvocation() {
        tracker.enter("p1");
        tracker.invocationStarted("p1", "inv-1");
        assertEquals(Optional.of("inv-1"), tracker.currentInvocation("p1"));

        tracker.invocationFinished("p1", "inv-other");
        assertEquals(Optional.of("inv-1"), tracker.currentInvocation("p1"));

        tracker.release("p1");
        assertEquals(Optional.empty(), tracker.currentInvocation("p1"));
    }

    @Test
    void shouldLetOnlyOneOfManyConcurrentEntersWin() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger losers = new AtomicInteger();
        try {
            for (int i = 0; i < 6; i++) {
                pool.submit(() -> {
                    start.await();
                    try {
                        tracker.enter("p1");
                        winners.incrementAndGet();
                    } catch (ConcurrentModificationException e) {
                        losers.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, winners.get());
        assertEquals(5, losers.get());
    }
}
