package com.mobifone.broker.repository;

import com.mobifone.broker.entity.UserGroup;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserGroupRepository extends JpaRepository<UserGroup, String> {
    List<UserGroup> findByAuthenticatorAndNameContainingIgnoreCaseOrderByName(String authenticator, String name, Pageable pageable);
}
