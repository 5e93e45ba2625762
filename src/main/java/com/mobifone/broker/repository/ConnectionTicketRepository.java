package com.mobifone.broker.repository;

import com.mobifone.broker.entity.ConnectionTicket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ConnectionTicketRepository extends JpaRepository<ConnectionTicket, String> {

    /** Returns 1 for the single caller that consumed the ticket, 0 for everyone else. */
    @Transactional
    @Modifying
    @Query("delete from ConnectionTicket t where t.id = :id and t.expiresAt > :now")
    int consume(@Param("id") String id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("delete from ConnectionTicket t where t.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
