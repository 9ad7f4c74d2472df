package com.smartbag.commerce.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    @JsonProperty("items")
    private List<OrderItemRequest> items;

    @JsonProperty("delivery_address")
    private DeliveryAddressRequest deliveryAddress;

    @JsonProperty("promo_code")
    private String promoCode;

    @JsonProperty("delivery_charge")
    private BigDecimal deliveryCharge;

    @JsonProperty("payment_method")
    private String paymentMethod;
}
