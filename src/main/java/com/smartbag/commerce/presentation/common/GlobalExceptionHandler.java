package com.smartbag.commerce.presentation.common;

import com.smartbag.commerce.common.exception.BizException;
import com.smartbag.commerce.common.exception.ErrorCode;
import com.smartbag.commerce.domain.inventory.StockReservationException;
import com.smartbag.commerce.presentation.common.response.ErrorResponse;
import com.smartbag.commerce.presentation.common.response.StockShortfallView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생하는 예외를 잡아서 통일된 에러 응답으로 변환
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_PRODUCT_INSUFFICIENT_STOCK",
 *   "error_message": "재고가 부족합니다 | ...",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456",
 *   "details": [{"product_id": "P1", "requested": 3, "available": 2, ...}]
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode 에 정의된 상태 코드
 * - 400 Bad Request: 파라미터 검증 실패, 필수 헤더 누락, 본문 파싱 실패
 * - 500 Internal Server Error: 그 외 서버 내부 오류
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 비즈니스 예외 (ErrorCode 상태 코드 사용)
     * 재고 관련 예외는 상품별 부족 정보를 details 로 함께 반환
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        List<StockShortfallView> details = null;
        if (e instanceof StockReservationException) {
            List<StockShortfallView> views = ((StockReservationException) e).getShortfalls().stream()
                    .map(StockShortfallView::from)
                    .collect(Collectors.toList());
            details = views.isEmpty() ? null : views;
        }

        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] 서버 측 비즈니스 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.debug("[GlobalExceptionHandler] 비즈니스 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage(), details);
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", e.getHeaderName() + " 헤더가 필요합니다");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", "요청 본문을 읽을 수 없습니다");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 예상하지 못한 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        logger.error("[GlobalExceptionHandler] 처리되지 않은 예외", e);
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(), ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
