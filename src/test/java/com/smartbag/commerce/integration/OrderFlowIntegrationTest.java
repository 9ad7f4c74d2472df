package com.smartbag.commerce.integration;

import com.smartbag.commerce.application.cart.CartService;
import com.smartbag.commerce.application.inventory.InventoryCoordinator;
import com.smartbag.commerce.application.order.OrderPlacementService;
import com.smartbag.commerce.application.order.OrderQueryService;
import com.smartbag.commerce.application.order.OrderStatusService;
import com.smartbag.commerce.application.order.dto.OrderLineCommand;
import com.smartbag.commerce.application.order.dto.PlaceOrderCommand;
import com.smartbag.commerce.domain.cart.Cart;
import com.smartbag.commerce.domain.cart.CartRepository;
import com.smartbag.commerce.domain.inventory.InsufficientStockException;
import com.smartbag.commerce.domain.notification.NotificationRepository;
import com.smartbag.commerce.domain.order.DeliveryAddress;
import com.smartbag.commerce.domain.order.Order;
import com.smartbag.commerce.domain.order.OrderRepository;
import com.smartbag.commerce.domain.order.OrderStatus;
import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductRepository;
import com.smartbag.commerce.infrastructure.cache.CacheStore;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * 주문 흐름 통합 테스트
 *
 * 실제 MongoDB/Redis 위에서 주문 접수 → 부수 작업 → 취소 흐름을 검증한다.
 */
@DisplayName("주문 흐름 통합 테스트")
class OrderFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private OrderPlacementService orderPlacementService;

    @Autowired
    private OrderStatusService orderStatusService;

    @Autowired
    private OrderQueryService orderQueryService;

    @Autowired
    private CartService cartService;

    @Autowired
    private CartRepository cartRepository;

    @Autowired
    private InventoryCoordinator inventoryCoordinator;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private CacheStore cacheStore;

    private String userId;
    private String productId;

    @BeforeEach
    void setUp() {
        userId = "user-" + UUID.randomUUID();
        productId = "prod-" + UUID.randomUUID();
        productRepository.save(Product.builder()
                .id(productId)
                .name("우유")
                .category("dairy")
                .price(new BigDecimal("2500"))
                .stock(5)
                .active(true)
                .build());
    }

    @Test
    @DisplayName("주문 접수 - 재고 차감, 장바구니 비우기, 접수 알림 저장")
    void placeOrder_EndToEnd() {
        // Given
        cartService.addItem(userId, productId, 2);

        // When
        Order order = orderPlacementService.placeOrder(command(2));

        // Then
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.PREPARING);
        assertThat(order.getStatusChangeHistory()).hasSize(1);
        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isEqualTo(3);
        assertThat(orderRepository.findById(order.getOrderId())).isPresent();

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            assertThat(notificationRepository.findByUserId(userId)).hasSize(1);
            Cart cart = cartRepository.findByUserId(userId).orElseThrow();
            assertThat(cart.getItems()).isEmpty();
        });
        assertThat(orderQueryService.getActiveOrder(userId)).isPresent();
    }

    @Test
    @DisplayName("재고보다 많이 주문하면 거절되고 재고는 그대로")
    void placeOrder_InsufficientStock() {
        assertThatThrownBy(() -> orderPlacementService.placeOrder(command(6)))
                .isInstanceOf(InsufficientStockException.class);

        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isEqualTo(5);
        assertThat(orderQueryService.getActiveOrder(userId)).isEmpty();
    }

    @Test
    @DisplayName("주문 취소 - 재고 복구, 진행 중 주문 없음")
    void cancelOrder_RestoresStock() {
        // Given
        Order order = orderPlacementService.placeOrder(command(4));
        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isEqualTo(1);

        // When
        Order cancelled = orderStatusService.cancelOrder(order.getOrderId(), userId, "홍길동", "변심");

        // Then
        assertThat(cancelled.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isEqualTo(5);
        assertThat(orderQueryService.getActiveOrder(userId)).isEmpty();
        assertThat(orderQueryService.getOrderDetail(userId, order.getOrderId()).getOrderStatus())
                .isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    @DisplayName("동시 주문 - 재고 5개에 3개씩 두 요청이면 하나만 성공")
    void concurrentOrders_NoOversell() throws InterruptedException {
        // Given
        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger success = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                ready.countDown();
                try {
                    start.await();
                    orderPlacementService.placeOrder(command(3));
                    success.incrementAndGet();
                } catch (InsufficientStockException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // Then
        assertThat(success.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(1);
        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isEqualTo(2);
    }

    @Test
    @DisplayName("재고 보류 후 해제하면 가용 재고 원복")
    void reservation_ReleaseRestoresAvailability() {
        // Given
        String orderId = "ORD-" + UUID.randomUUID();

        // When
        boolean reserved = inventoryCoordinator.reserveStock(orderId, productId, 2);

        // Then
        assertThat(reserved).isTrue();
        assertThat(inventoryCoordinator.getAvailableStock(List.of(productId))).containsEntry(productId, 3);
        assertThat(cacheStore.remainingTtl(RedisKeyType.RESERVATION.buildKey(orderId, productId))).isPresent();

        assertThat(inventoryCoordinator.releaseReservation(orderId)).isEqualTo(1);
        assertThat(inventoryCoordinator.getAvailableStock(List.of(productId))).containsEntry(productId, 5);
    }

    private PlaceOrderCommand command(int quantity) {
        return PlaceOrderCommand.builder()
                .userId(userId)
                .userName("홍길동")
                .items(List.of(OrderLineCommand.builder().productId(productId).quantity(quantity).build()))
                .deliveryAddress(DeliveryAddress.builder()
                        .recipient("홍길동")
                        .street("테헤란로 1")
                        .city("서울")
                        .build())
                .deliveryCharge(new BigDecimal("3000"))
                .build();
    }
}
