package com.example.arena.api.request;

import jakarta.validation.constraints.NotNull;

public record ReadyRequest(@NotNull(message = "ready is required") Boolean ready) {}
