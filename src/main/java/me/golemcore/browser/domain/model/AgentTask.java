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

package me.golemcore.browser.domain.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * One asynchronous agent execution and its status cell.
 *
 * <p>
 * Identity and inputs are immutable. The mutable part (status, result, error,
 * timestamps) is only touched inside {@code synchronized} methods, and each
 * transition method returns {@code false} instead of overwriting a state it
 * is not allowed to leave. Once COMPLETED or FAILED the task never changes.
 */
@Getter
public class AgentTask {

    private final String id;
    private final String sessionId;
    private final boolean ephemeralSession;
    private final String description;
    private final int maxSteps;
    private final String model;
    private final AgentTaskOptions options;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private AgentTaskStatus status = AgentTaskStatus.PENDING;
    @Getter(AccessLevel.NONE)
    private AgentRunResult result;
    @Getter(AccessLevel.NONE)
    private String error;
    @Getter(AccessLevel.NONE)
    private Instant startedAt;
    @Getter(AccessLevel.NONE)
    private Instant completedAt;

    @Builder
    public AgentTask(String id, String sessionId, boolean ephemeralSession, String description, int maxSteps,
            String model, AgentTaskOptions options, Instant createdAt) {
        this.id = id;
        this.sessionId = sessionId;
        this.ephemeralSession = ephemeralSession;
        this.description = description;
        this.maxSteps = maxSteps;
        this.model = model;
        this.options = options != null ? options : AgentTaskOptions.builder().build();
        this.createdAt = createdAt;
    }

    public synchronized AgentTaskStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized boolean markRunning(Instant now) {
        if (status != AgentTaskStatus.PENDING) {
            return false;
        }
        status = AgentTaskStatus.RUNNING;
        startedAt = now;
        return true;
    }

    public synchronized boolean complete(AgentRunResult runResult, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = AgentTaskStatus.COMPLETED;
        result = runResult;
        completedAt = now;
        return true;
    }

    public synchronized boolean fail(String message, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = AgentTaskStatus.FAILED;
        error = message != null && !message.isBlank() ? message : "Agent task failed";
        completedAt = now;
        return true;
    }

    public synchronized AgentTaskSnapshot snapshot() {
        return AgentTaskSnapshot.builder()
                .taskId(id)
                .sessionId(sessionId)
                .ephemeralSession(ephemeralSession)
                .task(description)
                .maxSteps(maxSteps)
                .model(model)
                .status(status.wireName())
                .result(result)
                .error(error)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}
