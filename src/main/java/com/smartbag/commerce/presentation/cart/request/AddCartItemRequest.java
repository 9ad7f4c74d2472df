package com.smartbag.commerce.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {
    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("quantity")
    private Integer quantity;
}
