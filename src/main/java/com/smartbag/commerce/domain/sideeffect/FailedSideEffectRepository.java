package com.smartbag.commerce.domain.sideeffect;

import java.util.List;

public interface FailedSideEffectRepository {

    FailedSideEffect save(FailedSideEffect failedSideEffect);

    List<FailedSideEffect> findByOrderId(String orderId);

    List<FailedSideEffect> findAllPending();
}
