package com.mobifone.broker.repository;

import com.mobifone.broker.entity.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByUsernameAndAuthenticator(String username, String authenticator);

    @Query("""
        select u from User u
        where u.authenticator = :authenticator
          and ( lower(u.username) like lower(concat('%', :kw, '%'))
             or lower(coalesce(u.realName, '')) like lower(concat('%', :kw, '%')) )
        order by u.username
    """)
    List<User> searchInAuthenticator(@Param("authenticator") String authenticator,
                                     @Param("kw") String kw,
                                     Pageable pageable);
}
