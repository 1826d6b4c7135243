package com.quillflow.quillflow_backend.controller;

import com.quillflow.quillflow_backend.model.domain.CostRecord;
import com.quillflow.quillflow_backend.model.dto.CreateTaskRequest;
import com.quillflow.quillflow_backend.model.dto.CreateTaskResponse;
import com.quillflow.quillflow_backend.model.dto.TaskView;
import com.quillflow.quillflow_backend.service.ContentTaskService;
import com.quillflow.quillflow_backend.service.TaskStreamService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class ContentTaskController {

    private final ContentTaskService taskService;
    private final TaskStreamService streamService;

    // 202: the task runs in the background; poll or stream for progress
    @PostMapping
    public ResponseEntity<CreateTaskResponse> create(@RequestBody CreateTaskRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(taskService.create(request));
    }

    @PostMapping("/run")
    public TaskView runBlocking(@RequestBody CreateTaskRequest request) {
        return taskService.runBlocking(request);
    }

    @GetMapping
    public List<TaskView> recent() {
        return taskService.recent();
    }

    @GetMapping("/{id}")
    public TaskView poll(@PathVariable UUID id) {
        return taskService.poll(id);
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID id,
                             @RequestParam(name = "after", defaultValue = "0") long after,
                             @RequestHeader(name = "Last-Event-ID", required = false) Long lastEventId) {
        return streamService.stream(id, lastEventId != null ? lastEventId : after);
    }

    @PostMapping("/{id}/cancel")
    public TaskView cancel(@PathVariable UUID id) {
        return taskService.cancel(id);
    }

    @GetMapping("/{id}/costs")
    public List<CostRecord> costs(@PathVariable UUID id) {
        return taskService.costs(id);
    }
}
