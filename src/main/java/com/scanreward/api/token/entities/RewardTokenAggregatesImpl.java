package com.scanreward.api.token.entities;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.Predicate;
import lombok.NonNull;
import lombok.val;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;

/**
 * Criteria API implementation of {@link RewardTokenAggregates}. Spring Data picks it up as a
 * fragment of {@link RewardTokenRepository}.
 */
class RewardTokenAggregatesImpl implements RewardTokenAggregates {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public long sumAmountMatching(@NonNull TokenFilter filter) {
        val cb = entityManager.getCriteriaBuilder();
        val query = cb.createQuery(Long.class);
        val root = query.from(RewardToken.class);

        val predicates = new ArrayList<Predicate>();
        if (filter.getState() != null) {
            predicates.add(cb.equal(root.get("state"), filter.getState()));
        }

        if (filter.getProductName() != null) {
            predicates.add(cb.equal(root.get("productName"), filter.getProductName()));
        }

        if (filter.getBatchId() != null) {
            predicates.add(cb.equal(root.get("batchId"), filter.getBatchId()));
        }

        query.select(cb.coalesce(cb.sum(root.<Long>get("amount")), 0L))
            .where(predicates.toArray(new Predicate[0]));

        return entityManager.createQuery(query).getSingleResult();
    }
}
