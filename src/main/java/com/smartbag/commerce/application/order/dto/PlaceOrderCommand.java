package com.smartbag.commerce.application.order.dto;

import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 주문 생성 커맨드 (Application layer 내부 DTO)
 * Presentation layer의 CreateOrderRequest와 독립적
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderCommand {
    private String userId;
    private String userName;
    private List<OrderLineCommand> items;
    private DeliveryAddress deliveryAddress;
    private String promoCode;
    private BigDecimal deliveryCharge;
    private PaymentMethod paymentMethod;
}
