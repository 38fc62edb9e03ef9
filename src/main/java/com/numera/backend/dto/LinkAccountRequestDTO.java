package com.numera.backend.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record LinkAccountRequestDTO(

        @NotBlank(message = "itemId is required")
        String itemId,

        @NotBlank(message = "accessToken is required")
        String accessToken,

        @NotBlank(message = "name is required")
        String name,

        @Pattern(regexp = "^[A-Za-z]{3}$", message = "currency must be a 3-letter code")
        String currency,

        String mask,

        String institutionName,

        BigDecimal currentBalance
) {}
