package me.golemcore.browser.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.adapter.inbound.web.OperationInvoker;
import me.golemcore.browser.domain.command.BrowserOperation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Background agent task submission and polling.
 */
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
public class AgentController {

    private final OperationInvoker invoker;

    @PostMapping("/task")
    public Mono<ResponseEntity<Object>> runTask(@RequestBody(required = false) Map<String, Object> body) {
        return invoker.invoke(BrowserOperation.RUN_AGENT_TASK.getName(), body);
    }

    @GetMapping("/task/{taskId}")
    public Mono<ResponseEntity<Object>> getTaskStatus(@PathVariable String taskId) {
        return invoker.invoke(BrowserOperation.GET_TASK_STATUS.getName(), null,
                BrowserOperation.Params.TASK_ID, taskId);
    }

    @GetMapping("/tasks")
    public Mono<ResponseEntity<Object>> listTasks() {
        return invoker.invoke(BrowserOperation.LIST_TASKS.getName(), Map.of());
    }
}
