package com.quillflow.quillflow_backend.service;

/**
 * A create or estimate request was rejected before any task was stored.
 */
public class TaskValidationException extends RuntimeException {

    public TaskValidationException(String message) {
        super(message);
    }
}
