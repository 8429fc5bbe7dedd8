package com.example.queue.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
