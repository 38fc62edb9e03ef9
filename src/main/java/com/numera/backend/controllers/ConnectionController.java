package com.numera.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.numera.backend.config.OpenApiConfig;
import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.ApiResponse;
import com.numera.backend.dto.IntegrationResponseDTO;
import com.numera.backend.dto.ProcessorKeyRequestDTO;
import com.numera.backend.services.connections.ConnectionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionService connectionService;

    @PutMapping("/processor/key")
    public ResponseEntity<ApiResponse<IntegrationResponseDTO>> registerProcessorKey(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @Valid @RequestBody ProcessorKeyRequestDTO request
    ) {
        IntegrationResponseDTO integration = connectionService.registerProcessorKey(userId, request.apiKey());
        return ResponseEntity.ok(ApiResponse.success(integration, "Payment processor connected"));
    }

    @DeleteMapping("/processor/key")
    public ResponseEntity<ApiResponse<Void>> disconnectProcessor(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId
    ) {
        connectionService.disconnectProcessor(userId);
        return ResponseEntity.ok(ApiResponse.success(null, "Payment processor disconnected"));
    }

    @GetMapping("/integrations")
    public ResponseEntity<ApiResponse<List<IntegrationResponseDTO>>> listIntegrations(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(ApiResponse.success(connectionService.listIntegrations(userId), "Integrations retrieved"));
    }

    @GetMapping("/accounts")
    public ResponseEntity<ApiResponse<List<AccountResponseDTO>>> listAccounts(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId
    ) {
        return ResponseEntity.ok(ApiResponse.success(connectionService.listAccounts(userId), "Accounts retrieved"));
    }

    @DeleteMapping("/accounts/{accountId}")
    public ResponseEntity<ApiResponse<Void>> deleteAccount(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @PathVariable UUID accountId
    ) {
        connectionService.deleteAccount(userId, accountId);
        return ResponseEntity.ok(ApiResponse.success(null, "Account deleted"));
    }
}
