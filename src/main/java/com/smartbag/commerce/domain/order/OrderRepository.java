package com.smartbag.commerce.domain.order;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 *
 * 규칙:
 * - insert 는 새 주문만 저장한다 (같은 ID가 있으면 DataAccessException)
 * - save 는 낙관적 락(version)을 사용하며 충돌 시 OptimisticLockingFailureException
 */
public interface OrderRepository {

    Order insert(Order order);

    Order save(Order order);

    Optional<Order> findById(String orderId);

    boolean existsById(String orderId);

    /**
     * 사용자의 가장 최근 주문 중 주어진 상태에 해당하는 1건
     */
    Optional<Order> findLatestByUserIdAndStatusIn(String userId, Collection<OrderStatus> statuses);

    /**
     * 사용자 주문 목록 (최신순)
     *
     * @param offset 건너뛸 주문 수
     * @param limit 최대 조회 수
     */
    List<Order> findByUserId(String userId, int offset, int limit);

    /**
     * 배달 파트너가 배정되지 않은 주문 (최신순)
     */
    List<Order> findUnassignedByStatusIn(Collection<OrderStatus> statuses, int limit);

    /**
     * 특정 파트너에게 배정된 주문 (최신순)
     */
    List<Order> findByDeliveryPartnerAndStatusIn(String partnerId, Collection<OrderStatus> statuses, int limit);
}
