package com.quillflow.quillflow_backend.engine;

import java.util.UUID;

public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(UUID taskId) {
        super("Task " + taskId + " was cancelled");
    }
}
