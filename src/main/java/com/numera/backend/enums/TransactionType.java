package com.numera.backend.enums;

public enum TransactionType {
    INCOME,
    EXPENSE
}
