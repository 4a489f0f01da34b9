package com.ecommerce.user.modules.account.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.ecommerce.user.modules.account.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID>, UserAccountRepositoryCustom {

    @Query("select ua from UserAccount ua where ua.email = lower(:email)")
    Optional<UserAccount> findByEmail(@Param("email") String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    @Query("""
            select case when count(ua) > 0 then true else false end
              from UserAccount ua
             where ua.username = :username
               and ua.id <> :excludedId
            """)
    boolean existsByUsernameExcluding(@Param("username") String username, @Param("excludedId") UUID excludedId);

    long countByActiveTrue();
}
