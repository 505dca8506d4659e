package com.chimera.orchestrator.api.dto;

import jakarta.validation.constraints.NotNull;

/** Request body for PUT /workflows/{id}/priority. */
public record ReprioritizeRequest(@NotNull Integer priority) {}
