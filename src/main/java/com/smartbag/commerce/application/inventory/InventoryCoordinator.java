package com.smartbag.commerce.application.inventory;

import com.smartbag.commerce.domain.inventory.InventoryResult;
import com.smartbag.commerce.domain.inventory.ReservationRecord;
import com.smartbag.commerce.domain.inventory.StockLine;
import com.smartbag.commerce.domain.inventory.StockShortfall;
import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductRepository;
import com.smartbag.commerce.infrastructure.cache.CacheStore;
import com.smartbag.commerce.infrastructure.config.RedisKeyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * InventoryCoordinator - 재고 조정 Application 서비스
 *
 * 역할:
 * - 주문 라인 전체에 대한 조건부 원자 차감 (stock >= n 인 경우에만 n 차감)
 * - 실패 라인을 모두 수집한 뒤 성공 라인을 보상(증가)으로 되돌림
 * - 확정 전 주문의 재고 보류(reservation) 기록 관리
 * - 표시용 가용 재고 조회 및 캐시 동기화
 *
 * 동시성:
 * - 애플리케이션 락/분산 락 없음
 * - 과판매 방지는 저장소의 조건부 단일 문서 갱신에만 의존
 *
 * 흐름 (reserveAndDecrement):
 * 1. 라인을 요청 순서대로 하나씩 조건부 차감
 * 2. 매칭 0건 → 상품 재조회로 실패 사유 판별 (없음/비활성 → 판매 불가, 그 외 → 재고 부족)
 * 3. 저장소 예외 → 일시적 오류로 기록하고 다음 라인 계속 처리
 * 4. 실패가 하나라도 있으면 성공 라인 모두 보상 후 실패 결과 반환
 * 5. 전부 성공하면 표시용 재고 캐시 무효화 후 성공 결과 반환
 */
@Service
public class InventoryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InventoryCoordinator.class);

    private final ProductRepository productRepository;
    private final CacheStore cacheStore;
    private final Duration reservationTtl;

    public InventoryCoordinator(ProductRepository productRepository,
                                CacheStore cacheStore,
                                @Value("${smartbag.inventory.reservation-ttl:30m}") Duration reservationTtl) {
        this.productRepository = productRepository;
        this.cacheStore = cacheStore;
        this.reservationTtl = reservationTtl;
    }

    /**
     * 주문 라인 일괄 차감
     *
     * 실패 결과가 반환될 때 성공했던 라인의 보상은 이미 시도된 상태다.
     * 보상 자체가 실패한 경우는 ERROR 로그로만 남기며 결과는 바뀌지 않는다.
     *
     * @param lines 요청 순서의 주문 라인
     * @return 성공(차감된 라인) 또는 실패(부족 정보 목록)
     */
    public InventoryResult reserveAndDecrement(List<StockLine> lines) {
        List<StockLine> decremented = new ArrayList<>();
        List<StockShortfall> shortfalls = new ArrayList<>();

        for (StockLine line : lines) {
            try {
                if (productRepository.decrementStockIfAvailable(line.getProductId(), line.getQuantity())) {
                    decremented.add(line);
                } else {
                    shortfalls.add(describeShortfall(line));
                }
            } catch (DataAccessException e) {
                log.warn("[InventoryCoordinator] 재고 차감 중 저장소 오류 - productId={}, error={}",
                        line.getProductId(), e.getMessage());
                shortfalls.add(StockShortfall.transientError(line.getProductId(), line.getQuantity()));
            }
        }

        if (!shortfalls.isEmpty()) {
            if (!decremented.isEmpty()) {
                log.info("[InventoryCoordinator] 일부 라인 실패로 차감 롤백 - rollback={}, failed={}",
                        decremented.size(), shortfalls.size());
                restore(decremented);
            }
            return InventoryResult.failure(shortfalls);
        }

        invalidateStockCache(decremented);
        return InventoryResult.success(decremented);
    }

    /**
     * 보상 증가 (주문 저장 실패, 주문 취소/환불)
     *
     * 라인별로 독립 실행하며 실패는 로그로 남기고 다음 라인을 계속 처리한다.
     *
     * @return 복구에 성공한 라인 수
     */
    public int restore(List<StockLine> lines) {
        int restored = 0;
        for (StockLine line : lines) {
            try {
                if (productRepository.incrementStock(line.getProductId(), line.getQuantity())) {
                    restored++;
                } else {
                    log.error("[InventoryCoordinator] 재고 복구 대상 상품 없음 - productId={}, quantity={}",
                            line.getProductId(), line.getQuantity());
                }
            } catch (DataAccessException e) {
                log.error("[InventoryCoordinator] 재고 복구 실패 - productId={}, quantity={}",
                        line.getProductId(), line.getQuantity(), e);
            }
        }
        invalidateStockCache(lines);
        return restored;
    }

    /**
     * 재고 보류 (확정 전 주문)
     *
     * 가용 재고(stock - 보류 합계)가 충분한 경우에만 보류 기록을 TTL 과 함께 남긴다.
     * 같은 주문/상품의 기록이 이미 있으면 수량을 덮어쓴다.
     *
     * @return 보류 성공 여부 (가용 재고 부족이나 캐시 장애 시 false)
     */
    public boolean reserveStock(String orderId, String productId, int quantity) {
        int available = getAvailableStock(List.of(productId)).getOrDefault(productId, 0);
        if (available < quantity) {
            log.info("[InventoryCoordinator] 보류 불가 - orderId={}, productId={}, available={}, requested={}",
                    orderId, productId, available, quantity);
            return false;
        }

        ReservationRecord record = new ReservationRecord(orderId, productId, quantity, LocalDateTime.now());
        if (!cacheStore.set(RedisKeyType.RESERVATION.buildKey(orderId, productId), record, reservationTtl)) {
            log.warn("[InventoryCoordinator] 보류 기록 저장 실패 - orderId={}, productId={}", orderId, productId);
            return false;
        }
        return true;
    }

    /**
     * 주문 확정: 보류 기록 제거 (차감은 reserveAndDecrement 가 이미 수행)
     *
     * @return 처리한 보류 기록 수
     */
    public int confirmReservation(String orderId) {
        int count = clearReservations(orderId);
        log.info("[InventoryCoordinator] 보류 확정 - orderId={}, count={}", orderId, count);
        return count;
    }

    /**
     * 주문 포기: 보류 기록을 지워 보류 수량을 가용 재고로 되돌림
     *
     * @return 해제한 보류 기록 수
     */
    public int releaseReservation(String orderId) {
        int count = clearReservations(orderId);
        log.info("[InventoryCoordinator] 보류 해제 - orderId={}, count={}", orderId, count);
        return count;
    }

    /**
     * 가용 재고 조회: max(0, stock - reserved)
     *
     * stock 은 표시용 캐시에서 먼저 읽고, 없으면 저장소에서 읽어 캐시에 다시 쓴다.
     * reserved 는 아직 만료되지 않은 보류 기록 수량의 합이다.
     * 존재하지 않는 상품은 결과에서 빠진다.
     */
    public Map<String, Integer> getAvailableStock(Collection<String> productIds) {
        Map<String, String> stockKeys = new LinkedHashMap<>();
        for (String productId : productIds) {
            stockKeys.put(productId, RedisKeyType.INVENTORY_STOCK.buildKey(productId));
        }
        Map<String, Object> cached = cacheStore.getMany(stockKeys.values());

        Map<String, Integer> stocks = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        stockKeys.forEach((productId, key) -> {
            Object value = cached.get(key);
            if (value instanceof Number) {
                stocks.put(productId, ((Number) value).intValue());
            } else {
                misses.add(productId);
            }
        });

        if (!misses.isEmpty()) {
            Map<String, Integer> fromStore = productRepository.findAllByIds(misses).stream()
                    .collect(Collectors.toMap(Product::getId, Product::getStock));
            Map<String, Integer> writeBack = new LinkedHashMap<>();
            fromStore.forEach((productId, stock) -> {
                stocks.put(productId, stock);
                writeBack.put(RedisKeyType.INVENTORY_STOCK.buildKey(productId), stock);
            });
            cacheStore.setMany(writeBack, RedisKeyType.INVENTORY_STOCK.getTtl());
        }

        Map<String, Integer> available = new LinkedHashMap<>();
        stocks.forEach((productId, stock) -> {
            available.put(productId, Math.max(0, stock - reservedQuantity(productId)));
        });
        return available;
    }

    /**
     * 표시용 재고 캐시를 저장소 값으로 갱신
     *
     * @return 갱신된 재고 (상품이 없으면 비어 있음)
     */
    public Optional<Integer> syncInventoryToCache(String productId) {
        Optional<Product> product = productRepository.findById(productId);
        if (product.isEmpty()) {
            cacheStore.delete(RedisKeyType.INVENTORY_STOCK.buildKey(productId));
            return Optional.empty();
        }
        int stock = product.get().getStock();
        cacheStore.set(RedisKeyType.INVENTORY_STOCK.buildKey(productId), stock, RedisKeyType.INVENTORY_STOCK.getTtl());
        return Optional.of(stock);
    }

    private StockShortfall describeShortfall(StockLine line) {
        Optional<Product> current;
        try {
            current = productRepository.findById(line.getProductId());
        } catch (DataAccessException e) {
            log.warn("[InventoryCoordinator] 실패 사유 조회 중 저장소 오류 - productId={}", line.getProductId());
            return StockShortfall.transientError(line.getProductId(), line.getQuantity());
        }
        if (current.isEmpty() || !current.get().isActive()) {
            String name = current.map(Product::getName).orElse(null);
            return StockShortfall.unavailable(line.getProductId(), name, line.getQuantity());
        }
        Product product = current.get();
        return StockShortfall.insufficient(product.getId(), product.getName(), product.getStock(), line.getQuantity());
    }

    /**
     * 만료되지 않은 보류 기록 수량 합계 (reservation:*:{productId})
     */
    private int reservedQuantity(String productId) {
        List<String> keys = cacheStore.keys(RedisKeyType.RESERVATION.buildKey("*", productId));
        if (keys.isEmpty()) {
            return 0;
        }
        int reserved = 0;
        for (Object value : cacheStore.getMany(keys).values()) {
            if (value instanceof ReservationRecord) {
                reserved += ((ReservationRecord) value).getQuantity();
            }
        }
        return reserved;
    }

    private int clearReservations(String orderId) {
        int count = 0;
        for (String key : cacheStore.keys(RedisKeyType.RESERVATION.buildPattern(orderId))) {
            if (cacheStore.delete(key)) {
                count++;
            }
        }
        return count;
    }

    private void invalidateStockCache(Collection<StockLine> lines) {
        for (StockLine line : lines) {
            cacheStore.delete(RedisKeyType.INVENTORY_STOCK.buildKey(line.getProductId()));
        }
    }
}
