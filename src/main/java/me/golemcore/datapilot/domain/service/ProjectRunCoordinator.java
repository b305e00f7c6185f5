package me.golemcore.datapilot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.datapilot.domain.exception.ConcurrentModificationException;
import me.golemcore.datapilot.domain.loop.LoopStateTracker;
import me.golemcore.datapilot.domain.loop.OrchestrationLoop;
import me.golemcore.datapilot.domain.model.TurnOutcome;
import me.golemcore.datapilot.port.outbound.ProjectPort;
import me.golemcore.datapilot.port.outbound.SandboxPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs project turns on the bounded project executor.
 *
 * <p>
 * Different projects run concurrently; a project has at most one turn queued
 * or running, and a second submission is rejected rather than queued.
 * {@link #cancel} interrupts the running turn and stops its sandbox
 * invocation, if any. Project writes from outside the loop go through
 * {@link #runExclusive} and hold the same slot as a turn while they run.
 */
@Service
@Slf4j
public class ProjectRunCoordinator {

    private final OrchestrationLoop orchestrationLoop;
    private final ProjectPort projects;
    private final SandboxPort sandbox;
    private final LoopStateTracker stateTracker;
    private final ExecutorService executor;
    private final ConcurrentMap<String, RunningTurn> running = new ConcurrentHashMap<>();

    public ProjectRunCoordinator(OrchestrationLoop orchestrationLoop, ProjectPort projects, SandboxPort sandbox,
            LoopStateTracker stateTracker, @Qualifier("projectRunExecutor") ExecutorService executor) {
        this.orchestrationLoop = orchestrationLoop;
        this.projects = projects;
        this.sandbox = sandbox;
        this.stateTracker = stateTracker;
        this.executor = executor;
    }

    /**
     * Queues a user turn.
     *
     * @throws me.golemcore.datapilot.domain.exception.ProjectNotFoundException
     *             if the project does not exist
     * @throws ConcurrentModificationException
     *             if the project already has a turn in progress
     */
    public CompletableFuture<TurnOutcome> submit(String projectId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Turn text must not be blank");
        }
        projects.snapshot(projectId);

        CompletableFuture<TurnOutcome> result = new CompletableFuture<>();
        AtomicBoolean started = new AtomicBoolean();
        RunningTurn turn = new RunningTurn(result, started);
        if (running.putIfAbsent(projectId, turn) != null || stateTracker.isActive(projectId)) {
            running.remove(projectId, turn);
            throw new ConcurrentModificationException(projectId,
                    "Project " + projectId + " is already processing a turn");
        }

        try {
            turn.task = executor.submit(() -> {
                started.set(true);
                TurnOutcome outcome = null;
                RuntimeException failure = null;
                try {
                    outcome = orchestrationLoop.processTurn(projectId, text);
                } catch (RuntimeException e) {
                    log.error("[Loop] Turn of project {} aborted: {}", projectId, e.getMessage(), e);
                    failure = e;
                } finally {
                    // Freed before the caller sees the result.
                    running.remove(projectId, turn);
                }
                if (failure != null) {
                    result.completeExceptionally(failure);
                } else {
                    result.complete(outcome);
                }
            });
        } catch (RuntimeException e) {
            running.remove(projectId, turn);
            throw e;
        }
        return result;
    }

    /**
     * Runs a project write that must not overlap a turn. Turns submitted while
     * it runs are rejected.
     *
     * @throws ConcurrentModificationException
     *             if the project has a turn or another such write in progress
     */
    public <T> T runExclusive(String projectId, Supplier<T> action) {
        RunningTurn guard = new RunningTurn(null, new AtomicBoolean(true));
        if (running.putIfAbsent(projectId, guard) != null || stateTracker.isActive(projectId)) {
            running.remove(projectId, guard);
            throw new ConcurrentModificationException(projectId, "Project " + projectId + " is processing a turn");
        }
        try {
            return action.get();
        } finally {
            running.remove(projectId, guard);
        }
    }

    /**
     * @return {@code false} if the project has no turn in progress
     */
    public boolean cancel(String projectId) {
        RunningTurn turn = running.get(projectId);
        if (turn == null || turn.result == null) {
            return false;
        }
        log.info("[Loop] Cancelling turn of project {}", projectId);
        stateTracker.currentInvocation(projectId).ifPresent(sandbox::cancel);
        Future<?> task = turn.task;
        if (task != null) {
            task.cancel(true);
        }
        if (!turn.started.get()) {
            running.remove(projectId, turn);
            turn.result.completeExceptionally(new CancellationException("Turn cancelled before it started"));
        }
        return true;
    }

    public boolean isRunning(String projectId) {
        RunningTurn turn = running.get(projectId);
        return turn != null && turn.result != null;
    }

    // An exclusive write holds the slot with a null result.
    private static final class RunningTurn {
        private final CompletableFuture<TurnOutcome> result;
        private final AtomicBoolean started;
        private volatile Future<?> task;

        private RunningTurn(CompletableFuture<TurnOutcome> result, AtomicBoolean started) {
            this.result = result;
            this.started = started;
        }
    }
}
