package com.smartbag.commerce.infrastructure.persistence.product;

import com.smartbag.commerce.domain.product.Product;
import com.smartbag.commerce.domain.product.ProductRepository;
import com.mongodb.client.result.UpdateResult;
import org.springframework.context.annotation.Primary;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB 기반 Product Repository 구현
 *
 * 재고 차감은 stock 조건을 필터에 포함한 단일 updateFirst 로 수행한다.
 * 필터와 $inc 가 하나의 문서 단위 원자 연산이므로 동시 요청 간 과판매가 발생하지 않는다.
 */
@Repository
@Primary
public class MongoProductRepository implements ProductRepository {

    private final MongoTemplate mongoTemplate;

    public MongoProductRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(mongoTemplate.findById(productId, Product.class));
    }

    @Override
    public List<Product> findAllByIds(Collection<String> productIds) {
        return mongoTemplate.find(query(where("id").in(productIds)), Product.class);
    }

    @Override
    public Product save(Product product) {
        return mongoTemplate.save(product);
    }

    /**
     * db.products.updateOne({_id, stock: {$gte: n}, is_active: true}, {$inc: {stock: -n}})
     */
    @Override
    public boolean decrementStockIfAvailable(String productId, int quantity) {
        Query filter = query(where("id").is(productId)
                .and("stock").gte(quantity)
                .and("active").is(true));
        Update update = new Update()
                .inc("stock", -quantity)
                .set("updatedAt", LocalDateTime.now());
        UpdateResult result = mongoTemplate.updateFirst(filter, update, Product.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public boolean incrementStock(String productId, int quantity) {
        Update update = new Update()
                .inc("stock", quantity)
                .set("updatedAt", LocalDateTime.now());
        UpdateResult result = mongoTemplate.updateFirst(query(where("id").is(productId)), update, Product.class);
        return result.getMatchedCount() > 0;
    }
}
