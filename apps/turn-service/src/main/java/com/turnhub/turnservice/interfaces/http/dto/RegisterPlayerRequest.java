package com.turnhub.turnservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterPlayerRequest(@NotBlank String playerId, @NotBlank String nation) {
}
