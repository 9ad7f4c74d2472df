package com.smartbag.commerce.domain.order;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 라인/금액/배송지 스냅샷 보관
 * - 상태 전이 규칙 검증 (OrderStatus.canTransitionTo)
 * - 상태 변경 이력(statusChangeHistory) 기록
 *
 * 핵심 비즈니스 규칙:
 * - 생성 시 상태는 PREPARING, 이력은 정확히 1건
 * - 이력은 추가만 가능 (기존 항목 수정/삭제 불가)
 * - 배달 파트너 관련 전이는 배정된 파트너만 수행 가능
 * - 주문은 삭제되지 않고 상태만 전이된다
 */
@Document("orders")
@CompoundIndex(name = "user_created_idx", def = "{'user_id': 1, 'created_at': -1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    private static final String DEFAULT_ACTOR = "Customer";
    private static final int DEFAULT_ESTIMATED_DELIVERY_MINUTES = 30;

    @Id
    private String orderId;

    @Field("user_id")
    private String userId;

    private List<OrderItem> items = new ArrayList<>();

    @Field("order_status")
    private OrderStatus orderStatus;

    @Field("status_change_history")
    private List<StatusChange> statusChangeHistory = new ArrayList<>();

    private BigDecimal subtotal;

    @Field("delivery_charge")
    private BigDecimal deliveryCharge;

    @Field("promo_code")
    private String promoCode;

    @Field("promo_discount")
    private BigDecimal promoDiscount;

    @Field("total_amount")
    private BigDecimal totalAmount;

    @Field("delivery_address")
    private DeliveryAddress deliveryAddress;

    @Field("payment_method")
    private PaymentMethod paymentMethod;

    @Field("payment_status")
    private PaymentStatus paymentStatus;

    @Field("accepted_partners")
    private Set<String> acceptedPartners = new LinkedHashSet<>();

    @Field("delivery_partner")
    private String deliveryPartner;

    @Field("estimated_delivery_minutes")
    private int estimatedDeliveryMinutes;

    @Field("created_at")
    private LocalDateTime createdAt;

    @Field("updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 주문 라인은 1개 이상
     * - 최종 금액 = 소계 + 배송비 - 할인, 0보다 커야 함
     * - 초기 상태 PREPARING + 최초 이력 1건 (행위자 = 주문자 이름, 없으면 "Customer")
     */
    public static Order place(String orderId,
                              String userId,
                              String placedBy,
                              List<OrderItem> items,
                              DeliveryAddress deliveryAddress,
                              BigDecimal deliveryCharge,
                              String promoCode,
                              BigDecimal promoDiscount,
                              PaymentMethod paymentMethod) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 라인은 1개 이상이어야 합니다");
        }
        BigDecimal subtotal = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal charge = deliveryCharge != null ? deliveryCharge : BigDecimal.ZERO;
        BigDecimal discount = promoDiscount != null ? promoDiscount : BigDecimal.ZERO;
        BigDecimal total = subtotal.add(charge).subtract(discount);
        if (total.signum() <= 0) {
            throw new IllegalArgumentException("최종 금액은 0보다 커야 합니다: " + total);
        }

        LocalDateTime now = LocalDateTime.now();
        Order order = new Order();
        order.orderId = orderId;
        order.userId = userId;
        order.items = new ArrayList<>(items);
        order.subtotal = subtotal;
        order.deliveryCharge = charge;
        order.promoCode = promoCode;
        order.promoDiscount = discount;
        order.totalAmount = total;
        order.deliveryAddress = deliveryAddress;
        order.paymentMethod = paymentMethod != null ? paymentMethod : PaymentMethod.COD;
        order.paymentStatus = PaymentStatus.PENDING;
        order.estimatedDeliveryMinutes = DEFAULT_ESTIMATED_DELIVERY_MINUTES;
        order.createdAt = now;
        order.orderStatus = OrderStatus.PREPARING;
        order.appendHistory(OrderStatus.PREPARING,
                placedBy != null && !placedBy.isBlank() ? placedBy : DEFAULT_ACTOR,
                null, "주문이 접수되었습니다", now);
        return order;
    }

    /**
     * 배달 파트너의 주문 수락 (PREPARING|ASSIGNING → ASSIGNING)
     *
     * 수락은 배타적이지 않으며, 실제 배정은 assignPartner 에서 이루어진다.
     */
    public void accept(String partnerId, String partnerName) {
        if (orderStatus != OrderStatus.PREPARING && orderStatus != OrderStatus.ASSIGNING) {
            throw new InvalidOrderStatusException(orderId, orderStatus, OrderStatus.ASSIGNING);
        }
        if (deliveryPartner != null) {
            throw new InvalidOrderStatusException(orderId, "이미 배달 파트너가 배정된 주문입니다");
        }
        if (acceptedPartners.contains(partnerId)) {
            throw new OrderAlreadyAcceptedException(orderId, partnerId);
        }
        acceptedPartners.add(partnerId);
        transition(OrderStatus.ASSIGNING, partnerName, partnerId, partnerName + "님이 주문을 수락했습니다");
    }

    /**
     * 수락한 파트너 중 한 명을 배정 (ASSIGNING → ASSIGNED)
     */
    public void assignPartner(String partnerId, String assignedBy) {
        if (orderStatus != OrderStatus.ASSIGNING) {
            throw new InvalidOrderStatusException(orderId, orderStatus, OrderStatus.ASSIGNED);
        }
        if (!acceptedPartners.contains(partnerId)) {
            throw new PartnerMismatchException(orderId, partnerId);
        }
        this.deliveryPartner = partnerId;
        transition(OrderStatus.ASSIGNED, assignedBy, partnerId, "배달 파트너가 배정되었습니다");
    }

    public void startDelivery(String partnerId, String partnerName) {
        verifyAssignedPartner(partnerId);
        transition(OrderStatus.OUT_FOR_DELIVERY, partnerName, partnerId, "배달을 시작했습니다");
    }

    public void markArrived(String partnerId, String partnerName) {
        verifyAssignedPartner(partnerId);
        transition(OrderStatus.ARRIVED, partnerName, partnerId, "배달지에 도착했습니다");
    }

    /**
     * 배달 완료 (ASSIGNED|OUT_FOR_DELIVERY|ARRIVED → DELIVERED)
     * 현장 결제(COD) 주문은 결제 완료로 처리한다.
     */
    public void markDelivered(String partnerId, String partnerName) {
        verifyAssignedPartner(partnerId);
        transition(OrderStatus.DELIVERED, partnerName, partnerId, "배달이 완료되었습니다");
        if (paymentMethod == PaymentMethod.COD) {
            this.paymentStatus = PaymentStatus.COMPLETED;
        }
    }

    public void cancel(String cancelledBy, String reason) {
        transition(OrderStatus.CANCELLED, cancelledBy, null,
                reason != null && !reason.isBlank() ? reason : "주문이 취소되었습니다");
    }

    public void refund(String refundedBy, String reason) {
        transition(OrderStatus.REFUNDED, refundedBy, null,
                reason != null && !reason.isBlank() ? reason : "주문이 환불되었습니다");
        this.paymentStatus = PaymentStatus.REFUNDED;
    }

    public boolean isOwnedBy(String userId) {
        return this.userId != null && this.userId.equals(userId);
    }

    public boolean isActive() {
        return OrderStatus.ACTIVE.contains(orderStatus);
    }

    /**
     * 이력은 읽기 전용 뷰로만 노출
     */
    public List<StatusChange> getStatusChangeHistory() {
        return Collections.unmodifiableList(statusChangeHistory);
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Set<String> getAcceptedPartners() {
        return Collections.unmodifiableSet(acceptedPartners);
    }

    private void verifyAssignedPartner(String partnerId) {
        if (deliveryPartner == null || !deliveryPartner.equals(partnerId)) {
            throw new PartnerMismatchException(orderId, partnerId);
        }
    }

    private void transition(OrderStatus next, String changedBy, String partnerId, String message) {
        if (!orderStatus.canTransitionTo(next)) {
            throw new InvalidOrderStatusException(orderId, orderStatus, next);
        }
        this.orderStatus = next;
        appendHistory(next, changedBy, partnerId, message, LocalDateTime.now());
    }

    private void appendHistory(OrderStatus status, String changedBy, String partnerId, String message, LocalDateTime at) {
        statusChangeHistory.add(new StatusChange(status, at, changedBy, partnerId, message));
        this.updatedAt = at;
    }
}
