package com.numera.backend.enums;

public enum TransactionStatus {
    PENDING,
    COMPLETED
}
