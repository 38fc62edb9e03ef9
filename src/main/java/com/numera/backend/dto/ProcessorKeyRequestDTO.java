package com.numera.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record ProcessorKeyRequestDTO(
        @NotBlank(message = "apiKey is required")
        String apiKey
) {}
