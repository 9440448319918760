package com.turnhub.turnservice.interfaces.http.dto;

import jakarta.validation.constraints.Min;

public record RollbackRequest(@Min(1) int toTurn) {
}
