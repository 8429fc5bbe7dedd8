package com.example.queue.api.request;

import jakarta.validation.constraints.NotNull;

public record AddMessageRequest(@NotNull(message = "body is required") String body) {}
