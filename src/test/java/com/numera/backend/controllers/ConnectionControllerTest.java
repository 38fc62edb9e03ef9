package com.numera.backend.controllers;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.numera.backend.config.OpenApiConfig;
import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.IntegrationResponseDTO;
import com.numera.backend.enums.AccountOrigin;
import com.numera.backend.enums.IntegrationProvider;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.services.connections.ConnectionService;

@SpringBootTest
@AutoConfigureMockMvc
class ConnectionControllerTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConnectionService connectionService;

    @Test
    void registerProcessorKey_returnsStatusWithoutKey() throws Exception {
        when(connectionService.registerProcessorKey(USER_ID, "sk_test_abc"))
                .thenReturn(new IntegrationResponseDTO(UUID.randomUUID(), IntegrationProvider.STRIPE, "acct_1", null, true));

        mockMvc.perform(put("/api/ingestion/processor/key")
                        .header(OpenApiConfig.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\"sk_test_abc\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.provider").value("STRIPE"))
                .andExpect(jsonPath("$.data.accountId").value("acct_1"))
                .andExpect(jsonPath("$.data.connected").value(true))
                .andExpect(content().string(not(containsString("sk_test_abc"))));
    }

    @Test
    void registerProcessorKey_refusedKeyIs400() throws Exception {
        when(connectionService.registerProcessorKey(eq(USER_ID), any()))
                .thenThrow(new InputRejectedException("processor-key-invalid", "The payment processor rejected the API key"));

        mockMvc.perform(put("/api/ingestion/processor/key")
                        .header(OpenApiConfig.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\"sk_bad\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("processor-key-invalid"));
    }

    @Test
    void registerProcessorKey_blankKeyIsAValidationError() throws Exception {
        mockMvc.perform(put("/api/ingestion/processor/key")
                        .header(OpenApiConfig.USER_HEADER, USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\"\"}"))
                .andExpect(status().isBadRequest());

        verify(connectionService, never()).registerProcessorKey(any(), any());
    }

    @Test
    void disconnectProcessor_returnsOk() throws Exception {
        mockMvc.perform(delete("/api/ingestion/processor/key").header(OpenApiConfig.USER_HEADER, USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(connectionService).disconnectProcessor(USER_ID);
    }

    @Test
    void listAccounts_returnsCallerAccounts() throws Exception {
        when(connectionService.listAccounts(USER_ID)).thenReturn(List.of(new AccountResponseDTO(UUID.randomUUID(), "Checking",
                AccountOrigin.AGGREGATOR, "EUR", new BigDecimal("120.00"), "0042", "Test Bank", null)));

        mockMvc.perform(get("/api/ingestion/accounts").header(OpenApiConfig.USER_HEADER, USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name").value("Checking"))
                .andExpect(jsonPath("$.data[0].origin").value("AGGREGATOR"));
    }

    @Test
    void listIntegrations_returnsEmptyList() throws Exception {
        when(connectionService.listIntegrations(USER_ID)).thenReturn(List.of());

        mockMvc.perform(get("/api/ingestion/integrations").header(OpenApiConfig.USER_HEADER, USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void deleteAccount_ofAnotherUserIs403() throws Exception {
        UUID accountId = UUID.randomUUID();
        doThrow(new AuthorizationException("Account not found for the current user"))
                .when(connectionService).deleteAccount(USER_ID, accountId);

        mockMvc.perform(delete("/api/ingestion/accounts/" + accountId).header(OpenApiConfig.USER_HEADER, USER_ID.toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errors[0]").value("not-authorized"));
    }
}
