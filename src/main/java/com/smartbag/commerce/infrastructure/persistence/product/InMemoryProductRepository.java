package com.smartbag.commerce.infrastructure.persistence.product;

import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * InMemory Product Repository 구현
 * ConcurrentHashMap 기반의 인메모리 저장소 (Infrastructure 계층)
 *
 * 조건부 차감은 ConcurrentHashMap.compute 안에서 검사와 차감을 함께 수행하여
 * 문서 저장소의 단일 문서 원자 갱신과 같은 보장을 제공한다.
 */
@Repository
public class InMemoryProductRepository implements ProductRepository {

    private final ConcurrentMap<String, Product> products = new ConcurrentHashMap<>();

    @Override
    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public List<Product> findAllByIds(Collection<String> productIds) {
        List<Product> found = new ArrayList<>();
        for (String productId : productIds) {
            Product product = products.get(productId);
            if (product != null) {
                found.add(product);
            }
        }
        return found;
    }

    @Override
    public Product save(Product product) {
        products.put(product.getId(), product);
        return product;
    }

    @Override
    public boolean decrementStockIfAvailable(String productId, int quantity) {
        AtomicBoolean decremented = new AtomicBoolean(false);
        products.computeIfPresent(productId, (id, product) -> {
            decremented.set(product.tryDecreaseStock(quantity));
            return product;
        });
        return decremented.get();
    }

    @Override
    public boolean incrementStock(String productId, int quantity) {
        AtomicBoolean incremented = new AtomicBoolean(false);
        products.computeIfPresent(productId, (id, product) -> {
            product.increaseStock(quantity);
            incremented.set(true);
            return product;
        });
        return incremented.get();
    }
}
