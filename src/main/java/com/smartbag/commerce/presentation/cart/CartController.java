package com.smartbag.commerce.presentation.cart;

import com.smartbag.commerce.application.cart.CartService;
import com.smartbag.commerce.domain.cart.Cart;
import com.smartbag.commerce.presentation.cart.mapper.CartMapper;
import com.smartbag.commerce.presentation.cart.request.AddCartItemRequest;
import com.smartbag.commerce.presentation.cart.request.UpdateQuantityRequest;
import com.smartbag.commerce.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") String userId) {
        Cart cart = cartService.getCart(userId);
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }

    /**
     * DELETE /cart - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(@RequestHeader("X-USER-ID") String userId) {
        cartService.clearCart(userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /cart/items - 장바구니 상품 추가 (같은 상품이면 수량 합산)
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItem(
            @RequestHeader("X-USER-ID") String userId,
            @RequestBody AddCartItemRequest request) {
        int quantity = request.getQuantity() != null ? request.getQuantity() : 0;
        Cart cart = cartService.addItem(userId, request.getProductId(), quantity);
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartResponse(cart));
    }

    /**
     * PUT /cart/items/{item_id} - 수량 변경
     */
    @PutMapping("/items/{item_id}")
    public ResponseEntity<CartResponse> updateCartItemQuantity(
            @RequestHeader("X-USER-ID") String userId,
            @PathVariable("item_id") String itemId,
            @RequestBody UpdateQuantityRequest request) {
        int quantity = request.getQuantity() != null ? request.getQuantity() : 0;
        Cart cart = cartService.updateItem(userId, itemId, quantity);
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }

    @DeleteMapping("/items/{item_id}")
    public ResponseEntity<CartResponse> removeCartItem(
            @RequestHeader("X-USER-ID") String userId,
            @PathVariable("item_id") String itemId) {
        Cart cart = cartService.removeItem(userId, itemId);
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }
}
