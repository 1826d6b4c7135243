package com.quillflow.quillflow_backend.model.dto;

public record ErrorResponse(String code, String message) {}
