package com.ecommerce.user.modules.account.infrastructure.persistence;

import java.util.List;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import org.springframework.stereotype.Repository;

import com.ecommerce.user.modules.account.domain.UserAccount;

@Repository
public class UserAccountRepositoryImpl implements UserAccountRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<UserAccount> findActiveWindow(long offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0) {
            return List.of();
        }
        if (offset > Integer.MAX_VALUE) {
            return List.of();
        }
        return entityManager.createQuery("""
                        select ua
                          from UserAccount ua
                         where ua.active = true
                         order by ua.createdAt desc, ua.id
                        """, UserAccount.class)
                .setFirstResult((int) offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
