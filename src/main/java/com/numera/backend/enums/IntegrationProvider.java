package com.numera.backend.enums;

public enum IntegrationProvider {
    STRIPE
}
