package com.numera.backend.enums;

public enum AccountOrigin {
    AGGREGATOR,
    MANUAL
}
