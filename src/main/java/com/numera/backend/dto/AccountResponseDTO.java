package com.numera.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.numera.backend.entities.Account;
import com.numera.backend.enums.AccountOrigin;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AccountResponseDTO {

    private UUID id;
    private String name;
    private AccountOrigin origin;
    private String currency;
    private BigDecimal currentBalance;
    private String mask;
    private String institutionName;
    private LocalDateTime lastSyncedAt;

    public static AccountResponseDTO from(Account account) {
        if (account == null) {
            return null;
        }
        return new AccountResponseDTO(
                account.getId(),
                account.getName(),
                account.getOrigin(),
                account.getCurrency(),
                account.getCurrentBalance(),
                account.getMask(),
                account.getInstitutionName(),
                account.getLastSyncedAt()
        );
    }
}
