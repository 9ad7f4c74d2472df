package com.smartbag.commerce.application.sideeffect;

import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import com.smartbag.commerce.domain.sideeffect.SideEffectType;

/**
 * 부수 작업 유형별 처리기
 *
 * handle 은 실패 시 예외를 던진다. 재시도와 DLQ 이동은 SideEffectWorker 가 담당한다.
 */
public interface SideEffectHandler {

    SideEffectType getType();

    void handle(SideEffectTask task);
}
