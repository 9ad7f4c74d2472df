package com.smartbag.commerce.domain.sideeffect;

public enum FailedSideEffectStatus {
    PENDING,
    RESOLVED
}
