package me.golemcore.datapilot.domain.loop;

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
import me.golemcore.datapilot.domain.model.LoopState;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Observable loop state per project, and the guard that keeps at most one
 * active loop per project.
 *
 * <p>
 * A project without an entry is {@link LoopState#AWAITING_USER}.
 */
@Component
@Slf4j
public class LoopStateTracker {

    private final ConcurrentMap<String, LoopState> states = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> invocations = new ConcurrentHashMap<>();

    /**
     * Claims the project for one turn.
     *
     * @throws ConcurrentModificationException
     *             if a turn of this project is already in progress
     */
    public void enter(String projectId) {
        if (states.putIfAbsent(projectId, LoopState.MODEL_THINKING) != null) {
            throw new ConcurrentModificationException(projectId,
                    "Project " + projectId + " is already processing a turn");
        }
        log.debug("[Loop] {}: {} -> {}", projectId, LoopState.AWAITING_USER, LoopState.MODEL_THINKING);
    }

    public void transition(String projectId, LoopState next) {
        LoopState previous = states.computeIfPresent(projectId, (id, current) -> next);
        if (previous == null) {
            throw new IllegalStateException("Project " + projectId + " has no active turn");
        }
        log.debug("[Loop] {}: -> {}", projectId, next);
    }

    public void release(String projectId) {
        invocations.remove(projectId);
        if (states.remove(projectId) != null) {
            log.debug("[Loop] {}: -> {}", projectId, LoopState.AWAITING_USER);
        }
    }

    public LoopState current(String projectId) {
        return states.getOrDefault(projectId, LoopState.AWAITING_USER);
    }

    public boolean isActive(String projectId) {
        return states.containsKey(projectId);
    }

    public void invocationStarted(String projectId, String invocationId) {
        invocations.put(projectId, invocationId);
    }

    public void invocationFinished(String projectId, String invocationId) {
        invocations.remove(projectId, invocationId);
    }

    public Optional<String> currentInvocation(String projectId) {
        return Optional.ofNullable(invocations.get(projectId));
    }
}
