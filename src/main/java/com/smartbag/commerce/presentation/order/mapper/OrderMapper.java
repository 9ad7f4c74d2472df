package com.smartbag.commerce.presentation.order.mapper;

import com.smartbag.commerce.application.order.dto.OrderLineCommand;
import com.smartbag.commerce.application.order.dto.OrderPage;
import com.smartbag.commerce.application.order.dto.PlaceOrderCommand;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.PaymentMethod;
import com.smartbag.commerce.presentation.order.request.CreateOrderRequest;
import com.smartbag.commerce.presentation.order.request.DeliveryAddressRequest;
import com.smartbag.commerce.presentation.order.request.OrderItemRequest;
import com.smartbag.commerce.presentation.order.response.OrderItemResponse;
import com.smartbag.commerce.presentation.order.response.OrderListResponse;
import com.smartbag.commerce.presentation.order.response.OrderResponse;
import com.smartbag.commerce.presentation.order.response.StatusChangeResponse;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Domain Order → Presentation Response DTO 변환
 */
@Component
public class OrderMapper {

    /**
     * CreateOrderRequest + 헤더 정보 → PlaceOrderCommand
     *
     * 결제 수단은 대소문자 구분 없이 받으며, 알 수 없는 값은 IllegalArgumentException (400)
     */
    public PlaceOrderCommand toPlaceOrderCommand(String userId, String userName, CreateOrderRequest request) {
        List<OrderLineCommand> items = request.getItems() == null
                ? Collections.emptyList()
                : request.getItems().stream()
                        .map(this::toOrderLineCommand)
                        .collect(Collectors.toList());

        return PlaceOrderCommand.builder()
                .userId(userId)
                .userName(userName)
                .items(items)
                .deliveryAddress(toDeliveryAddress(request.getDeliveryAddress()))
                .promoCode(request.getPromoCode())
                .deliveryCharge(request.getDeliveryCharge())
                .paymentMethod(toPaymentMethod(request.getPaymentMethod()))
                .build();
    }

    public OrderResponse toOrderResponse(Order order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .orderStatus(order.getOrderStatus().getValue())
                .items(order.getItems().stream()
                        .map(item -> OrderItemResponse.builder()
                                .productId(item.getProductId())
                                .productName(item.getProductName())
                                .quantity(item.getQuantity())
                                .price(item.getPrice())
                                .build())
                        .collect(Collectors.toList()))
                .subtotal(order.getSubtotal())
                .deliveryCharge(order.getDeliveryCharge())
                .promoCode(order.getPromoCode())
                .promoDiscount(order.getPromoDiscount())
                .totalAmount(order.getTotalAmount())
                .deliveryAddress(toDeliveryAddressResponse(order.getDeliveryAddress()))
                .paymentMethod(order.getPaymentMethod() != null ? order.getPaymentMethod().name() : null)
                .paymentStatus(order.getPaymentStatus() != null ? order.getPaymentStatus().name() : null)
                .deliveryPartner(order.getDeliveryPartner())
                .estimatedDeliveryMinutes(order.getEstimatedDeliveryMinutes())
                .statusChangeHistory(order.getStatusChangeHistory().stream()
                        .map(change -> StatusChangeResponse.builder()
                                .status(change.getStatus().getValue())
                                .changedAt(change.getChangedAt())
                                .changedBy(change.getChangedBy())
                                .partnerId(change.getPartnerId())
                                .message(change.getMessage())
                                .build())
                        .collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    public List<OrderResponse> toOrderResponses(List<Order> orders) {
        return orders.stream()
                .map(this::toOrderResponse)
                .collect(Collectors.toList());
    }

    public OrderListResponse toOrderListResponse(OrderPage page) {
        return OrderListResponse.builder()
                .orders(toOrderResponses(page.getOrders()))
                .page(page.getPage())
                .size(page.getSize())
                .hasNext(page.isHasNext())
                .build();
    }

    private OrderLineCommand toOrderLineCommand(OrderItemRequest request) {
        return OrderLineCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
    }

    private DeliveryAddress toDeliveryAddress(DeliveryAddressRequest request) {
        if (request == null) {
            return null;
        }
        return DeliveryAddress.builder()
                .recipient(request.getRecipient())
                .phone(request.getPhone())
                .street(request.getStreet())
                .city(request.getCity())
                .postalCode(request.getPostalCode())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .build();
    }

    private DeliveryAddressRequest toDeliveryAddressResponse(DeliveryAddress address) {
        if (address == null) {
            return null;
        }
        return DeliveryAddressRequest.builder()
                .recipient(address.getRecipient())
                .phone(address.getPhone())
                .street(address.getStreet())
                .city(address.getCity())
                .postalCode(address.getPostalCode())
                .latitude(address.getLatitude())
                .longitude(address.getLongitude())
                .build();
    }

    private PaymentMethod toPaymentMethod(String paymentMethod) {
        if (paymentMethod == null || paymentMethod.isBlank()) {
            return null;
        }
        try {
            return PaymentMethod.valueOf(paymentMethod.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("지원하지 않는 결제 수단입니다: " + paymentMethod, e);
        }
    }
}
