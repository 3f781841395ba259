package com.custodia.auditservice.api.dto;

import jakarta.validation.constraints.NotBlank;

public record FlagRequest(@NotBlank String reason) {}
