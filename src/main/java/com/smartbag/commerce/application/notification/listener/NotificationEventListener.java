package com.smartbag.commerce.application.notification.listener;

import com.smartbag.commerce.domain.notification.Notification;
import com.smartbag.commerce.domain.notification.NotificationRepository;
import com.smartbag.commerce.domain.notification.NotificationType;
import com.smartbag.commerce.domain.order.event.OrderPlacedEvent;
import com.smartbag.commerce.domain.order.event.OrderStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 주문 이벤트를 사용자 알림 기록으로 저장
 *
 * 부수 작업 워커 스레드에서 동기 실행된다. 저장 실패는 예외로 전파되어 워커가 재시도한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationEventListener {

    private final NotificationRepository notificationRepository;

    @EventListener
    public void handleOrderPlaced(OrderPlacedEvent event) {
        notificationRepository.save(Notification.builder()
                .userId(event.getUserId())
                .orderId(event.getOrderId())
                .type(NotificationType.ORDER_PLACED)
                .title("주문 접수")
                .message(String.format("주문 %s이(가) 접수되었습니다. 결제 금액: %s원",
                        event.getOrderId(), event.getTotalAmount().toPlainString()))
                .read(false)
                .createdAt(LocalDateTime.now())
                .build());
        log.info("[NotificationEventListener] 주문 접수 알림 저장 - orderId={}, userId={}",
                event.getOrderId(), event.getUserId());
    }

    @EventListener
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        notificationRepository.save(Notification.builder()
                .userId(event.getUserId())
                .orderId(event.getOrderId())
                .type(NotificationType.ORDER_STATUS)
                .title("주문 상태 변경")
                .message(String.format("주문 %s의 상태가 '%s'(으)로 변경되었습니다.",
                        event.getOrderId(), event.getNewStatus().getDisplayName()))
                .read(false)
                .createdAt(LocalDateTime.now())
                .build());
        log.info("[NotificationEventListener] 상태 변경 알림 저장 - orderId={}, status={}",
                event.getOrderId(), event.getNewStatus());
    }
}
