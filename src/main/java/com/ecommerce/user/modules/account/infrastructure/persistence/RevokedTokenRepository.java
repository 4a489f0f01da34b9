package com.ecommerce.user.modules.account.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.ecommerce.user.modules.account.domain.RevokedToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RevokedTokenRepository extends JpaRepository<RevokedToken, String> {

    @Modifying
    @Query("delete from RevokedToken rt where rt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
