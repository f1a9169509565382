package com.hermes.shared.model;

public enum ClaimStatus {
    WARM,
    CLAIMED,
    PROCESSING,
    IDLE
}
