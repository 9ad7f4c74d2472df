package com.smartbag.commerce.application.cart;

import com.smartbag.commerce.domain.cart.Cart;
import com.smartbag.commerce.domain.cart.CartConstants;
import com.smartbag.commerce.domain.cart.CartItem;
import com.smartbag.commerce.domain.cart.CartItemNotFoundException;
import com.smartbag.commerce.domain.cart.CartRepository;
import com.smartbag.commerce.domain.cart.InvalidQuantityException;
import com.smartbag.commerce.domain.inventory.InsufficientStockException;
import com.smartbag.commerce.domain.inventory.StockShortfall;
import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductNotFoundException;
import com.smartbag.commerce.domain.product.ProductRepository;
import com.smartbag.commerce.infrastructure.cache.TwoTierCache;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * CartService - 장바구니 Application 서비스
 *
 * 책임:
 * - 장바구니 조회 (L1 + L2 캐시)
 * - 항목 추가/수정/삭제/비우기
 *
 * 규칙:
 * - 수량은 1 이상 maxQuantityPerProduct 이하 (같은 상품 추가 시 합산 수량 기준)
 * - 활성 상품만 담을 수 있고, 담는 수량은 현재 재고를 넘을 수 없음
 * - 모든 변경 후 cart:{userId} 캐시 무효화
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final TwoTierCache twoTierCache;
    private final int maxQuantityPerProduct;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository,
                       TwoTierCache twoTierCache,
                       @Value("${smartbag.cart.max-quantity-per-product:" + CartConstants.DEFAULT_MAX_QUANTITY_PER_PRODUCT + "}")
                       int maxQuantityPerProduct) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.twoTierCache = twoTierCache;
        this.maxQuantityPerProduct = maxQuantityPerProduct;
    }

    /**
     * 장바구니 조회 (없으면 빈 장바구니)
     *
     * 저장소에서 읽는 동안 장바구니 캐시가 무효화되면 읽은 값을 캐시에 쓰지 않는다.
     */
    public Cart getCart(String userId) {
        String key = RedisKeyType.CART.buildKey(userId);
        long generation = twoTierCache.invalidationGeneration();
        return twoTierCache.get(key, Cart.class, true)
                .orElseGet(() -> {
                    Cart cart = cartRepository.findByUserId(userId).orElseGet(() -> Cart.empty(userId));
                    twoTierCache.populate(key, cart, RedisKeyType.CART.getTtl(), true, generation);
                    return cart;
                });
    }

    /**
     * 상품 추가 (이미 담긴 상품이면 수량 합산)
     */
    public Cart addItem(String userId, String productId, int quantity) {
        validateQuantity(quantity);
        Product product = loadActiveProduct(productId);

        Cart cart = cartRepository.findByUserId(userId).orElseGet(() -> Cart.empty(userId));
        int merged = cart.findItemByProductId(productId).map(CartItem::getQuantity).orElse(0) + quantity;
        if (merged > maxQuantityPerProduct) {
            throw new InvalidQuantityException(merged, maxQuantityPerProduct);
        }
        verifyStock(product, merged);

        cart.addItem(productId, quantity, maxQuantityPerProduct);
        return saveAndEvict(cart);
    }

    /**
     * 항목 수량 변경
     */
    public Cart updateItem(String userId, String itemId, int quantity) {
        validateQuantity(quantity);
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartItemNotFoundException(itemId));
        CartItem item = cart.findItem(itemId)
                .orElseThrow(() -> new CartItemNotFoundException(itemId));
        verifyStock(loadActiveProduct(item.getProductId()), quantity);

        cart.updateItemQuantity(itemId, quantity, maxQuantityPerProduct);
        return saveAndEvict(cart);
    }

    public Cart removeItem(String userId, String itemId) {
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartItemNotFoundException(itemId));
        cart.removeItem(itemId);
        return saveAndEvict(cart);
    }

    public void clearCart(String userId) {
        boolean cleared = cartRepository.clearItems(userId);
        twoTierCache.delete(RedisKeyType.CART.buildKey(userId));
        log.debug("[CartService] 장바구니 비우기 - userId={}, cleared={}", userId, cleared);
    }

    private void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > maxQuantityPerProduct) {
            throw new InvalidQuantityException(quantity, maxQuantityPerProduct);
        }
    }

    private Product loadActiveProduct(String productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        if (!product.isActive()) {
            throw new ProductNotFoundException(productId);
        }
        return product;
    }

    private void verifyStock(Product product, int quantity) {
        if (product.getStock() < quantity) {
            throw new InsufficientStockException(List.of(
                    StockShortfall.insufficient(product.getId(), product.getName(), product.getStock(), quantity)));
        }
    }

    private Cart saveAndEvict(Cart cart) {
        Cart saved = cartRepository.save(cart);
        twoTierCache.delete(RedisKeyType.CART.buildKey(cart.getUserId()));
        return saved;
    }
}
