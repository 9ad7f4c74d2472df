package com.smartbag.commerce.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("items")
    private List<CartItemResponse> items;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;
}
