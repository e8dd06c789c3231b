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

package me.golemcore.browser.domain.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.exception.OrchestrationException;
import me.golemcore.browser.domain.model.AgentRunRequest;
import me.golemcore.browser.domain.model.AgentRunResult;
import me.golemcore.browser.domain.model.AgentTask;
import me.golemcore.browser.domain.model.AgentTaskOptions;
import me.golemcore.browser.domain.model.AgentTaskSnapshot;
import me.golemcore.browser.domain.model.BrowserSession;
import me.golemcore.browser.domain.model.SessionConfig;
import me.golemcore.browser.infrastructure.config.BrowserApiProperties;
import me.golemcore.browser.port.outbound.AgentExecutionPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Schedules and tracks autonomous agent tasks.
 *
 * <p>
 * Submission registers a PENDING task and returns its id without waiting.
 * The work runs on the {@code agentTaskExecutor}, never on a session's
 * command thread, so a long agent run only occupies the session queue for
 * the individual browser commands it issues.
 *
 * <p>
 * Every failure of the agent capability (exception, task timeout,
 * interruption) ends the task in FAILED with a message. The status cell of a
 * task only moves forward, so a result that arrives after a timeout is
 * discarded.
 *
 * <p>
 * Terminal tasks are kept for {@code browser-api.tasks.retention} and then
 * evicted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentTaskManager {

    private static final String LOG_PREFIX = "[Tasks]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;
    private static final String EPHEMERAL_SESSION_PREFIX = "agent_";
    private static final Runnable NO_CLEANUP = () -> {
    };

    private final AgentExecutionPort agentExecutionPort;
    private final SessionRegistry sessionRegistry;
    private final ExecutorService agentTaskExecutor;
    private final BrowserApiProperties properties;
    private final Clock clock;

    private final Map<String, AgentTask> tasks = new ConcurrentHashMap<>();

    private final ScheduledExecutorService retentionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "task-retention");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long intervalMs = properties.getTasks().getEvictionInterval().toMillis();
        retentionExecutor.scheduleAtFixedRate(this::evictExpiredTasks, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void destroy() {
        retentionExecutor.shutdownNow();
        try {
            retentionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run an agent task against an existing session.
     *
     * @return the id of the PENDING task
     */
    public String submit(String description, String sessionId, int maxSteps, String model,
            AgentTaskOptions options) {
        BrowserSession session = sessionRegistry.resolve(sessionId);
        AgentTask task = register(newTaskId(), session.getId(), false, description, maxSteps, model, options);

        session.acquireTaskLease();
        launch(task, () -> agentExecutionPort.run(toRunRequest(task), session.getHandle()),
                session::releaseTaskLease);
        return task.getId();
    }

    /**
     * Run an agent task in a private session provisioned for it. The session
     * uses the task's allow-list and headless flag, holds a task lease while
     * the agent runs so the idle sweep leaves it alone, and is closed when the
     * agent returns, whatever the outcome.
     *
     * @return the id of the PENDING task
     */
    public String submitWithEphemeralSession(String description, int maxSteps, String model,
            AgentTaskOptions options) {
        String taskId = newTaskId();
        String sessionId = EPHEMERAL_SESSION_PREFIX + taskId;
        AgentTask task = register(taskId, sessionId, true, description, maxSteps, model, options);

        SessionConfig config = SessionConfig.builder()
                .headless(task.getOptions().isHeadless())
                .allowedDomains(new ArrayList<>(task.getOptions().getAllowedDomains()))
                .waitBetweenActions(properties.getSessions().getDefaultWaitBetweenActions())
                .build();

        launch(task, () -> {
            BrowserSession session = sessionRegistry.createEphemeral(sessionId, config);
            session.acquireTaskLease();
            try {
                return agentExecutionPort.run(toRunRequest(task), session.getHandle());
            } finally {
                session.releaseTaskLease();
                closeEphemeralSession(sessionId);
            }
        }, NO_CLEANUP);
        return taskId;
    }

    public AgentTaskSnapshot getStatus(String taskId) {
        AgentTask task = taskId != null ? tasks.get(taskId) : null;
        if (task == null) {
            throw OrchestrationException.notFound("Task " + taskId + " not found");
        }
        return task.snapshot();
    }

    public List<AgentTaskSnapshot> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(AgentTask::getCreatedAt).thenComparing(AgentTask::getId))
                .map(AgentTask::snapshot)
                .toList();
    }

    public long countActive() {
        return tasks.values().stream()
                .filter(task -> !task.getStatus().isTerminal())
                .count();
    }

    public boolean hasActiveTask(String sessionId) {
        return tasks.values().stream()
                .anyMatch(task -> task.getSessionId().equals(sessionId) && !task.getStatus().isTerminal());
    }

    void evictExpiredTasks() {
        Instant cutoff = clock.instant().minus(properties.getTasks().getRetention());
        int before = tasks.size();
        tasks.values().removeIf(task -> {
            Instant completedAt = task.getCompletedAt();
            return task.getStatus().isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
        });
        int evicted = before - tasks.size();
        if (evicted > 0) {
            log.debug("{} Evicted {} finished tasks", LOG_PREFIX, evicted);
        }
    }

    private AgentTask register(String taskId, String sessionId, boolean ephemeral, String description,
            int maxSteps, String model, AgentTaskOptions options) {
        AgentTask task = AgentTask.builder()
                .id(taskId)
                .sessionId(sessionId)
                .ephemeralSession(ephemeral)
                .description(description)
                .maxSteps(maxSteps)
                .model(model)
                .options(options)
                .createdAt(clock.instant())
                .build();
        tasks.put(taskId, task);
        log.info("{} Task {} submitted (session: {}, max steps: {}, model: {})", LOG_PREFIX, taskId, sessionId,
                maxSteps, model);
        return task;
    }

    /**
     * Start the work on the agent executor. The task-level timeout is armed
     * when the task starts running, so time spent queued for a worker does not
     * count against it. {@code cleanup} runs exactly once, when the work has
     * returned or was never started.
     */
    private void launch(AgentTask task, Supplier<AgentRunResult> work, Runnable cleanup) {
        Duration timeout = properties.getTasks().getTimeout();
        CompletableFuture<AgentRunResult> outcome = new CompletableFuture<>();
        outcome.whenComplete((result, error) -> finish(task, result, error));
        try {
            CompletableFuture
                    .supplyAsync(() -> {
                        try {
                            if (!task.markRunning(clock.instant())) {
                                return null;
                            }
                            outcome.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                            log.debug("{} Task {} running", LOG_PREFIX, task.getId());
                            return work.get();
                        } finally {
                            cleanup.run();
                        }
                    }, agentTaskExecutor)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            outcome.completeExceptionally(error);
                        } else {
                            outcome.complete(result);
                        }
                    });
        } catch (RejectedExecutionException e) {
            cleanup.run();
            task.fail("Task executor is not accepting work: " + e.getMessage(), clock.instant());
            log.warn("{} Task {} rejected by executor", LOG_PREFIX, task.getId());
        }
    }

    private void finish(AgentTask task, AgentRunResult result, Throwable error) {
        Instant now = clock.instant();
        if (error != null) {
            String message = describeFailure(error);
            if (task.fail(message, now)) {
                log.warn("{} Task {} failed: {}", LOG_PREFIX, task.getId(), message);
            }
            return;
        }
        if (result == null) {
            return;
        }
        boolean applied;
        if (result.isSuccessful()) {
            applied = task.complete(result, now);
        } else {
            applied = task.fail(describeUnsuccessful(task, result), now);
        }
        if (applied) {
            log.info("{} Task {} {} after {} steps", LOG_PREFIX, task.getId(), task.getStatus().wireName(),
                    result.getStepsCompleted());
        } else {
            log.debug("{} Discarded late result of task {} (already {})", LOG_PREFIX, task.getId(),
                    task.getStatus().wireName());
        }
    }

    private String describeFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "Task timed out after " + properties.getTasks().getTimeout();
        }
        if (cause instanceof InterruptedException) {
            return "Task was interrupted";
        }
        return OrchestrationException.classify(cause).getMessage();
    }

    private String describeUnsuccessful(AgentTask task, AgentRunResult result) {
        if (result.getErrors() != null && !result.getErrors().isEmpty()) {
            return result.getErrors().get(result.getErrors().size() - 1);
        }
        return "Agent did not complete the task within " + task.getMaxSteps() + " steps";
    }

    private AgentRunRequest toRunRequest(AgentTask task) {
        return AgentRunRequest.builder()
                .taskId(task.getId())
                .description(task.getDescription())
                .maxSteps(task.getMaxSteps())
                .model(task.getModel())
                .useVision(task.getOptions().isUseVision())
                .deadline(task.getStartedAt().plus(properties.getTasks().getTimeout()))
                .build();
    }

    private void closeEphemeralSession(String sessionId) {
        try {
            sessionRegistry.close(sessionId);
        } catch (OrchestrationException e) {
            log.warn("{} Could not close ephemeral session {}: {}", LOG_PREFIX, sessionId, e.getMessage());
        }
    }

    private static String newTaskId() {
        return "task_" + UUID.randomUUID().toString().replace("-", "");
    }
}
