package com.numera.backend.controllers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.numera.backend.config.OpenApiConfig;
import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.ApiResponse;
import com.numera.backend.dto.ExtractionPreviewDTO;
import com.numera.backend.dto.ImportConfirmRequestDTO;
import com.numera.backend.dto.IngestionRunSummaryDTO;
import com.numera.backend.dto.LinkAccountRequestDTO;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.services.reconciliation.IngestionReconciler;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionReconciler reconciler;

    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ExtractionPreviewDTO>> previewDocument(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @RequestParam("file") MultipartFile file
    ) {
        ExtractionPreviewDTO preview = reconciler.previewDocument(
                userId, readBytes(file), file.getContentType(), file.getOriginalFilename());
        return ResponseEntity.ok(ApiResponse.success(preview, "Document extracted"));
    }

    @PostMapping(value = "/spreadsheets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ExtractionPreviewDTO>> previewSpreadsheet(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @RequestParam("file") MultipartFile file
    ) {
        String content = new String(readBytes(file), StandardCharsets.UTF_8);
        ExtractionPreviewDTO preview = reconciler.previewSpreadsheet(userId, content);
        return ResponseEntity.ok(ApiResponse.success(preview, "Spreadsheet extracted"));
    }

    @PostMapping("/imports")
    public ResponseEntity<ApiResponse<IngestionRunSummaryDTO>> confirmImport(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @Valid @RequestBody ImportConfirmRequestDTO request
    ) {
        IngestionRunSummaryDTO summary = reconciler.confirmImport(userId, request);
        return ResponseEntity.status(201).body(ApiResponse.success(summary, summary.getCount() + " transactions imported"));
    }

    @PostMapping("/aggregator/accounts")
    public ResponseEntity<ApiResponse<AccountResponseDTO>> linkAggregatorAccount(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @Valid @RequestBody LinkAccountRequestDTO request
    ) {
        AccountResponseDTO account = reconciler.linkAggregatorAccount(userId, request);
        return ResponseEntity.status(201).body(ApiResponse.success(account, "Account linked"));
    }

    @PostMapping("/aggregator/accounts/{accountId}/sync")
    public ResponseEntity<ApiResponse<IngestionRunSummaryDTO>> syncAggregatorAccount(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId,
            @PathVariable UUID accountId
    ) {
        IngestionRunSummaryDTO summary = reconciler.syncAggregatorAccount(userId, accountId);
        return ResponseEntity.ok(ApiResponse.success(summary, summary.getCount() + " transactions synced"));
    }

    @PostMapping("/processor/sync")
    public ResponseEntity<ApiResponse<IngestionRunSummaryDTO>> syncProcessor(
            @RequestHeader(OpenApiConfig.USER_HEADER) UUID userId
    ) {
        IngestionRunSummaryDTO summary = reconciler.syncProcessor(userId);
        return ResponseEntity.ok(ApiResponse.success(summary, summary.getCount() + " transactions synced"));
    }

    private static byte[] readBytes(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InputRejectedException("file-missing", "File is missing or empty");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            log.warn("[IngestionController] could not read upload: {}", e.getMessage());
            throw new InputRejectedException("file-unreadable", "The uploaded file could not be read");
        }
    }
}
