package com.smartbag.commerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartbag.commerce.presentation.order.request.DeliveryAddressRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO (생성/상세/상태 변경 공통)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {
    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("order_status")
    private String orderStatus;

    @JsonProperty("items")
    private List<OrderItemResponse> items;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    @JsonProperty("delivery_charge")
    private BigDecimal deliveryCharge;

    @JsonProperty("promo_code")
    private String promoCode;

    @JsonProperty("promo_discount")
    private BigDecimal promoDiscount;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("delivery_address")
    private DeliveryAddressRequest deliveryAddress;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("payment_status")
    private String paymentStatus;

    @JsonProperty("delivery_partner")
    private String deliveryPartner;

    @JsonProperty("estimated_delivery_minutes")
    private Integer estimatedDeliveryMinutes;

    @JsonProperty("status_change_history")
    private List<StatusChangeResponse> statusChangeHistory;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;
}
