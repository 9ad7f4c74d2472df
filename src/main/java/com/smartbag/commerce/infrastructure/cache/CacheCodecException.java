package com.smartbag.commerce.infrastructure.cache;

/**
 * 캐시 값 인코딩/디코딩 실패 (CacheStore 내부에서만 사용, 외부로 전파되지 않음)
 */
public class CacheCodecException extends RuntimeException {

    public CacheCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
