package me.golemcore.datapilot.domain.service;

import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.exception.ProjectNotFoundException;
import me.golemcore.datapilot.domain.loop.LoopStateTracker;
import me.golemcore.datapilot.domain.loop.OrchestrationLoop;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.ProviderUsage;
import me.golemcore.datapilot.domain.model.TurnOutcome;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import me.golemcore.datapilot.port.outbound.SandboxPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProjectRunCoordinatorTest {

    private OrchestrationLoop loop;
    private ProjectPort projects;
    private SandboxPort sandbox;
    private LoopStateTracker tracker;
    private ExecutorService executor;
    private ProjectRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        loop = mock(OrchestrationLoop.class);
        projects = mock(ProjectPort.class);
        sandbox = mock(SandboxPort.class);
        tracker = new LoopStateTracker();
        executor = Executors.newSingleThreadExecutor();
        coordinator = new ProjectRunCoordinator(loop, projects, sandbox, tracker, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCompleteWithLoopOutcome() throws Exception {
        TurnOutcome outcome = outcome("p1", true);
        when(loop.processTurn("p1", "profile my data")).thenReturn(outcome);

        TurnOutcome result = coordinator.submit("p1", "profile my data").get(5, TimeUnit.SECONDS);

        assertSame(outcome, result);
        awaitIdle();
        assertFalse(coordinator.isRunning("p1"));
    }

    @Test
    void shouldRejectBlankText() {
        assertThrows(IllegalArgumentException.class, () -> coordinator.submit("p1", "  "));
        verify(loop, never()).processTurn(anyString(), anyString());
    }

    @Test
    void shouldRejectUnknownProjectBeforeQueueing() {
        when(projects.snapshot("missing")).thenThrow(new ProjectNotFoundException("missing"));

        assertThrows(ProjectNotFoundException.class, () -> coordinator.submit("missing", "hello"));
        assertFalse(coordinator.isRunning("missing"));
    }

    @Test
    void shouldRejectSecondTurnWhileRunning() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(loop.processTurn(eq("p1"), anyString())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return outcome("p1", true);
        });

        CompletableFuture<TurnOutcome> first = coordinator.submit("p1", "train");
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(ConcurrentModificationException.class, () -> coordinator.submit("p1", "again"));
        assertTrue(coordinator.isRunning("p1"));

        release.countDown();
        assertTrue(first.get(5, TimeUnit.SECONDS).completed());
    }

    @Test
    void shouldAcceptNextTurnAsSoonAsResultArrives() throws Exception {
        TurnOutcome outcome = outcome("p1", true);
        when(loop.processTurn(eq("p1"), anyString())).thenReturn(outcome);

        CompletableFuture<TurnOutcome> next = coordinator.submit("p1", "profile")
                .thenCompose(first -> coordinator.submit("p1", "explore"));

        assertSame(outcome, next.get(5, TimeUnit.SECONDS));
        verify(loop).processTurn("p1", "explore");
    }

    @Test
    void shouldRejectExclusiveWriteWhileTurnRuns() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(loop.processTurn(eq("p1"), anyString())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return outcome("p1", true);
        });

        CompletableFuture<TurnOutcome> turn = coordinator.submit("p1", "train");
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(ConcurrentModificationException.class,
                () -> coordinator.runExclusive("p1", () -> "renamed"));

        release.countDown();
        turn.get(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldRejectTurnWhileExclusiveWriteRuns() {
        String result = coordinator.runExclusive("p1", () -> {
            assertThrows(ConcurrentModificationException.class, () -> coordinator.submit("p1", "train"));
            assertFalse(coordinator.cancel("p1"));
            assertFalse(coordinator.isRunning("p1"));
            return "renamed";
        });

        assertEquals("renamed", result);
        verify(loop, never()).processTurn(anyString(), anyString());
    }

    @Test
    void shouldReleaseSlotWhenExclusiveWriteFails() throws Exception {
        when(loop.processTurn(eq("p1"), anyString())).thenReturn(outcome("p1", true));

        assertThrows(IllegalStateException.class, () -> coordinator.runExclusive("p1", () -> {
            throw new IllegalStateException("disk full");
        }));

        assertTrue(coordinator.submit("p1", "train").get(5, TimeUnit.SECONDS).completed());
    }

    @Test
    void shouldStopSandboxAndInterruptTurnOnCancel() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        when(loop.processTurn(eq("p1"), anyString())).thenAnswer(invocation -> {
            tracker.enter("p1");
            tracker.invocationStarted("p1", "inv-7");
            entered.countDown();
            try {
                new CountDownLatch(1).await(5, TimeUnit.SECONDS);
                return outcome("p1", true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return outcome("p1", false);
            } finally {
                tracker.release("p1");
            }
        });

        CompletableFuture<TurnOutcome> future = coordinator.submit("p1", "train for an hour");
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(coordinator.cancel("p1"));

        verify(sandbox).cancel("inv-7");
        assertFalse(future.get(5, TimeUnit.SECONDS).completed());
    }

    @Test
    void shouldCompleteQueuedTurnExceptionallyOnCancel() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(loop.processTurn(eq("busy"), anyString())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return outcome("busy", true);
        });
        CompletableFuture<TurnOutcome> busy = coordinator.submit("busy", "long turn");
        CompletableFuture<TurnOutcome> queued = coordinator.submit("p1", "waiting");

        assertTrue(coordinator.cancel("p1"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> queued.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, error.getCause());
        assertFalse(coordinator.isRunning("p1"));
        release.countDown();
        busy.get(5, TimeUnit.SECONDS);
        verify(loop, never()).processTurn(eq("p1"), anyString());
    }

    @Test
    void shouldReturnFalseOnCancelWithoutRunningTurn() {
        assertFalse(coordinator.cancel("p1"));
    }

    @Test
    void shouldFailFutureOnLoopError() {
        when(loop.processTurn("p1", "hello")).thenThrow(new IllegalStateException("boom"));

        CompletableFuture<TurnOutcome> future = coordinator.submit("p1", "hello");

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    private void awaitIdle() throws InterruptedException {
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    private static TurnOutcome outcome(String projectId, boolean completed) {
        return new TurnOutcome(projectId, completed, List.of(), PipelineStage.INGEST, 1, 0, ProviderUsage.NONE);
    }
}
