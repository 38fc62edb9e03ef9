package com.numera.backend.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.numera.backend.entities.Integration;
import com.numera.backend.enums.IntegrationProvider;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Connection status of a payment processor. The stored API key is never exposed.
 */
@Data
@AllArgsConstructor
public class IntegrationResponseDTO {

    private UUID id;
    private IntegrationProvider provider;
    private String accountId;
    private LocalDateTime lastSyncedAt;
    private boolean connected;

    public static IntegrationResponseDTO from(Integration integration) {
        if (integration == null) {
            return null;
        }
        return new IntegrationResponseDTO(
                integration.getId(),
                integration.getProvider(),
                integration.getExternalAccountId(),
                integration.getLastSyncedAt(),
                integration.getApiKey() != null && !integration.getApiKey().isBlank()
        );
    }
}
