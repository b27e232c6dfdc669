package com.shareplan.domain.model;

public enum WarningType {
    CLASSIFICATION_GAP,
    FX_UNAVAILABLE,
    OUTSTANDING_MISMATCH,
    AS_OF_PRICE_MISMATCH
}
