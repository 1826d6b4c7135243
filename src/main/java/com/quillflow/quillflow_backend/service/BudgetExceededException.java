package com.quillflow.quillflow_backend.service;

/**
 * Raised at creation time only when pipeline.budget.policy is BLOCK.
 */
public class BudgetExceededException extends RuntimeException {

    public BudgetExceededException(String message) {
        super(message);
    }
}
