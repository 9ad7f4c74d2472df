package com.smartbag.commerce.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 *
 * 재고 변경 규칙:
 * - decrementStockIfAvailable 는 "stock >= n 이고 활성 상품이면 n 차감"을 단일 원자 연산으로 수행해야 한다
 * - 읽고 나서 쓰는 방식(read-then-write)은 허용되지 않는다
 * - 저장소 접근 실패는 Spring DataAccessException 으로 전파된다
 */
public interface ProductRepository {

    Optional<Product> findById(String productId);

    /**
     * ID 목록으로 일괄 조회 (존재하지 않는 ID는 결과에서 빠짐)
     */
    List<Product> findAllByIds(Collection<String> productIds);

    Product save(Product product);

    /**
     * 조건부 재고 차감
     *
     * @return 조건을 만족하여 차감되었으면 true, 매칭된 문서가 없으면 false
     */
    boolean decrementStockIfAvailable(String productId, int quantity);

    /**
     * 재고 증가 (롤백/취소 보상)
     *
     * @return 대상 상품이 존재하여 증가되었으면 true
     */
    boolean incrementStock(String productId, int quantity);
}
