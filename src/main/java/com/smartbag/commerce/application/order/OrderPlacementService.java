package com.smartbag.commerce.application.order;

import com.smartbag.commerce.application.inventory.InventoryCoordinator;
import com.smartbag.commerce.application.order.dto.OrderLineCommand;
import com.smartbag.commerce.application.order.dto.PlaceOrderCommand;
import com.smartbag.commerce.application.sideeffect.SideEffectQueue;
import com.smartbag.commerce.domain.coupon.Coupon;
import com.smartbag.commerce.domain.coupon.CouponRepository;
import com.smartbag.commerce.domain.inventory.InsufficientStockException;
import com.smartbag.commerce.domain.inventory.InventoryResult;
import com.smartbag.commerce.domain.inventory.ProductUnavailableException;
import com.smartbag.commerce.domain.inventory.StockLine;
import com.smartbag.commerce.domain.inventory.TransientStoreException;
import com.smartbag.commerce.domain.order.InvalidOrderInputException;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderItem;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductNotFoundException;
import com.smartbag.commerce.domain.product.ProductRepository;
import com.smartbag.commerce.domain.sideeffect.SideEffectTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OrderPlacementService - 주문 접수 유스케이스 (Application 계층)
 *
 * 플로우:
 * 1. 입력 검증 (라인/수량/배송지/배송비), 같은 상품 라인은 합산
 * 2. 상품 일괄 조회 (없거나 비활성 → ProductNotFoundException)
 * 3. 프로모션 코드 검증 및 할인 계산
 * 4. 최종 금액 > 0 확인
 * 5. InventoryCoordinator 로 재고 일괄 차감 (실패 시 롤백 완료 상태로 예외)
 * 6. 주문 생성 및 저장 (저장 실패 시 재고 복구 후 TransientStoreException)
 * 7. 부수 작업 큐 적재 (쿠폰 사용, 장바구니 비우기, 캐시 무효화, order_placed)
 * 8. 저장된 주문 반환
 *
 * 재시도:
 * - TransientStoreException 에 한해 전체 흐름을 1회 재시도 (총 2회, 200ms 대기)
 * - 실패한 시도는 이미 재고 보상을 마친 상태이므로 재시도해도 이중 차감되지 않는다
 */
@Slf4j
@Service
public class OrderPlacementService {

    private final ProductRepository productRepository;
    private final CouponRepository couponRepository;
    private final OrderRepository orderRepository;
    private final InventoryCoordinator inventoryCoordinator;
    private final OrderIdGenerator orderIdGenerator;
    private final SideEffectQueue sideEffectQueue;

    public OrderPlacementService(ProductRepository productRepository,
                                 CouponRepository couponRepository,
                                 OrderRepository orderRepository,
                                 InventoryCoordinator inventoryCoordinator,
                                 OrderIdGenerator orderIdGenerator,
                                 SideEffectQueue sideEffectQueue) {
        this.productRepository = productRepository;
        this.couponRepository = couponRepository;
        this.orderRepository = orderRepository;
        this.inventoryCoordinator = inventoryCoordinator;
        this.orderIdGenerator = orderIdGenerator;
        this.sideEffectQueue = sideEffectQueue;
    }

    /**
     * 주문 접수
     *
     * @param command 주문 커맨드
     * @return 저장된 주문 (PREPARING)
     * @throws InvalidOrderInputException 입력/쿠폰/금액 검증 실패 (400)
     * @throws ProductNotFoundException 상품 없음/비활성 (404)
     * @throws InsufficientStockException 재고 부족 (409)
     * @throws ProductUnavailableException 처리 중 비활성화 (409)
     * @throws TransientStoreException 저장소 오류 (503)
     */
    @Retryable(retryFor = TransientStoreException.class, maxAttempts = 2, backoff = @Backoff(delay = 200))
    public Order placeOrder(PlaceOrderCommand command) {
        // 1. 입력 검증
        Map<String, Integer> quantities = validateAndMerge(command);

        // 2. 상품 일괄 조회
        Map<String, Product> products = loadProducts(quantities);
        List<OrderItem> items = new ArrayList<>();
        quantities.forEach((productId, quantity) -> {
            Product product = products.get(productId);
            items.add(new OrderItem(productId, product.getName(), quantity, product.getPrice()));
        });
        BigDecimal subtotal = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        // 3. 프로모션 할인
        BigDecimal discount = resolveDiscount(command.getPromoCode(), subtotal);

        // 4. 최종 금액
        BigDecimal deliveryCharge = command.getDeliveryCharge() != null ? command.getDeliveryCharge() : BigDecimal.ZERO;
        BigDecimal total = subtotal.add(deliveryCharge).subtract(discount);
        if (total.signum() <= 0) {
            throw new InvalidOrderInputException("최종 결제 금액은 0보다 커야 합니다: " + total);
        }

        // 5. 재고 차감
        List<StockLine> lines = quantities.entrySet().stream()
                .map(entry -> StockLine.of(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        InventoryResult result = inventoryCoordinator.reserveAndDecrement(lines);
        if (!result.isSuccess()) {
            throw toStockException(result);
        }

        // 6. 주문 저장
        Order saved = persist(command, items, deliveryCharge, discount, lines);

        // 7. 부수 작업
        enqueueSideEffects(saved);

        log.info("[OrderPlacementService] 주문 접수 완료 - orderId={}, userId={}, total={}",
                saved.getOrderId(), saved.getUserId(), saved.getTotalAmount());
        return saved;
    }

    private Map<String, Integer> validateAndMerge(PlaceOrderCommand command) {
        if (command.getUserId() == null || command.getUserId().isBlank()) {
            throw new InvalidOrderInputException("사용자 정보가 없습니다");
        }
        if (command.getItems() == null || command.getItems().isEmpty()) {
            throw new InvalidOrderInputException("주문 상품이 없습니다");
        }
        if (command.getDeliveryAddress() == null || !command.getDeliveryAddress().isResolvable()) {
            throw new InvalidOrderInputException("배송지 주소가 올바르지 않습니다");
        }
        if (command.getDeliveryCharge() != null && command.getDeliveryCharge().signum() < 0) {
            throw new InvalidOrderInputException("배송비는 음수일 수 없습니다");
        }

        Map<String, Integer> merged = new LinkedHashMap<>();
        for (OrderLineCommand line : command.getItems()) {
            if (line.getProductId() == null || line.getProductId().isBlank()) {
                throw new InvalidOrderInputException("상품 ID가 없습니다");
            }
            if (line.getQuantity() == null || line.getQuantity() < 1) {
                throw new InvalidOrderInputException("수량은 1 이상이어야 합니다: productId=" + line.getProductId());
            }
            merged.merge(line.getProductId(), line.getQuantity(), Integer::sum);
        }
        return merged;
    }

    private Map<String, Product> loadProducts(Map<String, Integer> quantities) {
        List<Product> found;
        try {
            found = productRepository.findAllByIds(quantities.keySet());
        } catch (DataAccessException e) {
            throw new TransientStoreException("상품 조회 중 저장소 오류", e);
        }
        Map<String, Product> products = found.stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
        for (String productId : quantities.keySet()) {
            Product product = products.get(productId);
            if (product == null || !product.isActive()) {
                throw new ProductNotFoundException(productId);
            }
        }
        return products;
    }

    private BigDecimal resolveDiscount(String promoCode, BigDecimal subtotal) {
        if (promoCode == null || promoCode.isBlank()) {
            return BigDecimal.ZERO;
        }
        Coupon coupon = couponRepository.findByCode(promoCode)
                .orElseThrow(() -> new InvalidOrderInputException("존재하지 않는 프로모션 코드입니다: " + promoCode));
        if (!coupon.isApplicable(subtotal, LocalDateTime.now())) {
            throw new InvalidOrderInputException("사용할 수 없는 프로모션 코드입니다: " + promoCode);
        }
        return coupon.calculateDiscount(subtotal);
    }

    private RuntimeException toStockException(InventoryResult result) {
        switch (result.getDominantReason()) {
            case TRANSIENT_STORE_ERROR:
                return new TransientStoreException(result.getShortfalls());
            case PRODUCT_UNAVAILABLE:
                return new ProductUnavailableException(result.getShortfalls());
            default:
                return new InsufficientStockException(result.getShortfalls());
        }
    }

    private Order persist(PlaceOrderCommand command,
                          List<OrderItem> items,
                          BigDecimal deliveryCharge,
                          BigDecimal discount,
                          List<StockLine> lines) {
        try {
            Order order = Order.place(
                    orderIdGenerator.nextId(),
                    command.getUserId(),
                    command.getUserName(),
                    items,
                    command.getDeliveryAddress(),
                    deliveryCharge,
                    command.getPromoCode(),
                    discount,
                    command.getPaymentMethod());
            return orderRepository.insert(order);
        } catch (DataAccessException e) {
            log.error("[OrderPlacementService] 주문 저장 실패, 재고 복구 - userId={}, lines={}",
                    command.getUserId(), lines.size(), e);
            inventoryCoordinator.restore(lines);
            throw new TransientStoreException("주문 저장 중 저장소 오류", e);
        }
    }

    private void enqueueSideEffects(Order order) {
        List<SideEffectTask> tasks = new ArrayList<>();
        if (order.getPromoCode() != null && !order.getPromoCode().isBlank()) {
            tasks.add(SideEffectTask.couponUsage(order.getOrderId(), order.getPromoCode()));
        }
        tasks.add(SideEffectTask.cartClear(order.getOrderId(), order.getUserId()));
        tasks.add(SideEffectTask.cacheInvalidation(order.getOrderId(), order.getUserId()));
        tasks.add(SideEffectTask.orderPlaced(order.getOrderId(), order.getUserId()));
        try {
            sideEffectQueue.enqueueAll(tasks);
        } catch (RuntimeException e) {
            log.error("[OrderPlacementService] 부수 작업 적재 실패 (주문은 유지) - orderId={}", order.getOrderId(), e);
        }
    }
}
