package com.smartbag.commerce.application.order.dto;

import com.smartbag.commerce.domain.order.Order;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 사용자 주문 목록 한 페이지 (캐시 저장 대상)
 */
@Getter
@NoArgsConstructor
public class OrderPage {

    private List<Order> orders = new ArrayList<>();
    private int page;
    private int size;
    private boolean hasNext;

    public OrderPage(List<Order> orders, int page, int size, boolean hasNext) {
        this.orders = new ArrayList<>(orders);
        this.page = page;
        this.size = size;
        this.hasNext = hasNext;
    }
}
