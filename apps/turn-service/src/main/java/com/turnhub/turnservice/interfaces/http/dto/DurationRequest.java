package com.turnhub.turnservice.interfaces.http.dto;

import jakarta.validation.constraints.Min;

public record DurationRequest(@Min(1) long seconds) {
}
